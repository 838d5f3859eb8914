package de.ialistannen.ocmirror.operator;

/**
 * Which channel of a package to mirror.
 */
public interface ChannelSelection {

  /**
   * Parses a {@code package[:channel]} argument.
   *
   * @param argument the argument
   * @return the package name and the selection
   */
  static PackageChannel parse(String argument) {
    int separator = argument.indexOf(':');
    if (separator < 0) {
      return new PackageChannel(argument, new DefaultChannel());
    }
    String packageName = argument.substring(0, separator);
    String channel = argument.substring(separator + 1);
    if (packageName.isBlank()) {
      throw new IllegalArgumentException("Missing package name in '" + argument + "'");
    }
    return new PackageChannel(packageName, channel.isBlank() ? new DefaultChannel() : new Explicit(channel));
  }

  /**
   * A named channel.
   *
   * @param name the channel name
   */
  record Explicit(String name) implements ChannelSelection {

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * Whatever channel the package declares as default.
   */
  record DefaultChannel() implements ChannelSelection {

    @Override
    public String toString() {
      return "<default>";
    }
  }

  /**
   * A parsed command line selection.
   *
   * @param packageName the package
   * @param channel the channel
   */
  record PackageChannel(String packageName, ChannelSelection channel) {

  }
}
