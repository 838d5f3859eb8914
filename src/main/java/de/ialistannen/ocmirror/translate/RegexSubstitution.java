package de.ialistannen.ocmirror.translate;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single endpoint rewrite rule.
 *
 * @param pattern the pattern to search for
 * @param replacement the literal replacement for the first match
 */
public record RegexSubstitution(Pattern pattern, String replacement) {

  public RegexSubstitution {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(replacement, "No replacement given for pattern '" + pattern.pattern() + "'");
  }

  public static RegexSubstitution of(String regex, String replacement) {
    return new RegexSubstitution(Pattern.compile(regex), replacement);
  }

  /**
   * Applies this rule.
   *
   * @param input the endpoint
   * @return the rewritten endpoint or an empty optional if the pattern did not match
   */
  public Optional<String> apply(String input) {
    Matcher matcher = pattern.matcher(input);
    if (!matcher.find()) {
      return Optional.empty();
    }
    return Optional.of(matcher.replaceFirst(Matcher.quoteReplacement(replacement)));
  }

  @Override
  public String toString() {
    return pattern.pattern() + " -> " + replacement;
  }
}
