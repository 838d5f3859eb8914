package de.ialistannen.ocmirror.signing;

import java.io.IOException;
import java.net.URI;
import java.util.Optional;

/**
 * Reads and writes single signature files.
 */
public interface SignatureStoreClient {

  /**
   * @param location the signature location
   * @return the signature, or an empty optional if there is none at that location
   * @throws IOException if an error occurs
   * @throws InterruptedException ?
   * @throws SignatureStoreException if the store answered with an unexpected status
   */
  Optional<byte[]> get(URI location) throws IOException, InterruptedException;

  /**
   * @param location the signature location
   * @param signature the signature to store
   * @throws IOException if an error occurs
   * @throws InterruptedException ?
   * @throws SignatureStoreException if the store refused the write
   */
  void put(URI location, byte[] signature) throws IOException, InterruptedException;
}
