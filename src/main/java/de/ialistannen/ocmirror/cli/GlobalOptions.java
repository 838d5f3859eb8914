package de.ialistannen.ocmirror.cli;

import java.util.List;
import java.util.Optional;

/**
 * Options shared by all commands.
 */
public interface GlobalOptions {

  boolean noCheckSignatures();

  boolean checkSignatures();

  boolean dryRun();

  List<String> signatureStores();

  List<String> signingKeys();

  Optional<String> dockerConfigPath();

  Optional<Integer> concurrency();

  Optional<String> platform();

  Optional<Integer> verbosity();
}
