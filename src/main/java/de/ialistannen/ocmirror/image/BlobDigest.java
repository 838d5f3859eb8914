package de.ialistannen.ocmirror.image;

import com.google.common.hash.Hashing;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A content address of the form {@code algorithm:hex}. Used to deduplicate identical layers and configs across
 * images.
 *
 * @param algorithm the hash algorithm, e.g. {@code sha256}
 * @param hex the lowercase hex encoded hash
 */
public record BlobDigest(String algorithm, String hex) implements Comparable<BlobDigest> {

  private static final Pattern DIGEST_PATTERN = Pattern.compile("([a-z0-9]+(?:[.+_-][a-z0-9]+)*):([a-fA-F0-9]{32,})");

  public BlobDigest {
    if (algorithm == null || algorithm.isBlank()) {
      throw new IllegalArgumentException("Digest algorithm must not be empty");
    }
    if (hex == null || hex.isBlank()) {
      throw new IllegalArgumentException("Digest value must not be empty");
    }
    hex = hex.toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a digest string.
   *
   * @param digest the digest, e.g. {@code sha256:0123...}
   * @return the parsed digest
   * @throws IllegalArgumentException if the string is no valid digest
   */
  public static BlobDigest parse(String digest) {
    Matcher matcher = DIGEST_PATTERN.matcher(digest);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Invalid digest: '" + digest + "'");
    }
    return new BlobDigest(matcher.group(1), matcher.group(2));
  }

  /**
   * @param content the content to hash
   * @return the sha256 digest of the content
   */
  public static BlobDigest of(byte[] content) {
    return new BlobDigest("sha256", Hashing.sha256().hashBytes(content).toString());
  }

  /**
   * @param content the content to check
   * @return true if the content hashes to this digest
   */
  public boolean matches(byte[] content) {
    return "sha256".equals(algorithm) && equals(of(content));
  }

  /**
   * Returns the directory name signature stores use for this digest.
   *
   * @return {@code algorithm=hex}
   */
  public String storagePathSegment() {
    return algorithm + "=" + hex;
  }

  @Override
  public int compareTo(BlobDigest other) {
    return toString().compareTo(other.toString());
  }

  @Override
  public String toString() {
    return algorithm + ":" + hex;
  }
}
