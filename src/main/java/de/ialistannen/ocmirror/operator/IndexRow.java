package de.ialistannen.ocmirror.operator;

/**
 * The head of one channel of one package in an operator index.
 *
 * @param packageName the package
 * @param channel the channel
 * @param bundleImage the image of the channel head bundle, may be null for very old indices
 * @param bundleName the name of the channel head bundle
 * @param defaultChannel the default channel of the package
 */
public record IndexRow(
  String packageName,
  String channel,
  String bundleImage,
  String bundleName,
  String defaultChannel
) {

  public boolean isDefaultChannel() {
    return channel.equals(defaultChannel);
  }
}
