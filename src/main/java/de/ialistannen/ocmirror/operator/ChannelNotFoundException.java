package de.ialistannen.ocmirror.operator;

import de.ialistannen.ocmirror.graph.ReferenceResolutionException;

public class ChannelNotFoundException extends ReferenceResolutionException {

  public ChannelNotFoundException(String packageName, ChannelSelection channel) {
    super("Package '" + packageName + "' has no channel " + channel);
  }
}
