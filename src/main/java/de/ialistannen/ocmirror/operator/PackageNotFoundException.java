package de.ialistannen.ocmirror.operator;

import de.ialistannen.ocmirror.graph.ReferenceResolutionException;

public class PackageNotFoundException extends ReferenceResolutionException {

  public PackageNotFoundException(String packageName) {
    super("Package '" + packageName + "' does not exist in the index");
  }
}
