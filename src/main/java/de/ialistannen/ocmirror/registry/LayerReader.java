package de.ialistannen.ocmirror.registry;

import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.zstandard.ZstdCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads single files out of image layers. Layers may be plain, gzip or zstd compressed tarballs.
 */
public class LayerReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(LayerReader.class);

  private static final int ZSTD_MAGIC = 0xFD2FB528;
  private static final String WHITEOUT_PREFIX = ".wh.";
  private static final String OPAQUE_MARKER = ".wh..wh..opq";

  private final RegistryClient registry;

  public LayerReader(RegistryClient registry) {
    this.registry = registry;
  }

  /**
   * Reads files from the layers of an image, newest layer first. A path found in a newer layer shadows the same path
   * in older ones. Whiteouts ({@code .wh.<name>}) and opaque directory markers ({@code .wh..wh..opq}) hide the
   * matching paths of older layers.
   *
   * @param reference the repository holding the layers
   * @param layers the layers, base layer first (as in the manifest)
   * @param wanted selects the normalized paths (no leading {@code ./} or {@code /}) to read
   * @param done called after every layer with everything found so far, stops the walk when it returns true
   * @return the found files by normalized path
   * @throws IOException if a layer can not be read
   * @throws InterruptedException ?
   */
  public Map<String, byte[]> readNewestFirst(
    ImageReference reference,
    List<BlobDigest> layers,
    Predicate<String> wanted,
    Predicate<Map<String, byte[]>> done
  ) throws IOException, InterruptedException {
    Map<String, byte[]> found = new LinkedHashMap<>();
    Set<String> removed = new HashSet<>();
    Set<String> opaqueDirectories = new HashSet<>();

    for (int i = layers.size() - 1; i >= 0; i--) {
      BlobDigest layer = layers.get(i);
      LOGGER.debug("Scanning layer '{}' of '{}'", layer, reference);

      LayerContent content;
      try (InputStream inputStream = registry.openBlob(reference, layer)) {
        content = readLayer(
          inputStream,
          path -> wanted.test(path) && !found.containsKey(path) && !isHidden(path, removed, opaqueDirectories)
        );
      }
      content.files().forEach(found::putIfAbsent);
      removed.addAll(content.removed());
      opaqueDirectories.addAll(content.opaqueDirectories());

      if (done.test(found)) {
        break;
      }
    }

    return found;
  }

  /**
   * Reads all matching files from a single layer. Whiteout markers are never returned.
   *
   * @param layer the (possibly compressed) tar stream, not closed by this method
   * @param wanted selects the normalized paths to read
   * @return the file contents by normalized path
   * @throws IOException if the layer is no valid tarball
   */
  public static Map<String, byte[]> readFiles(InputStream layer, Predicate<String> wanted) throws IOException {
    return readLayer(layer, wanted).files();
  }

  private static LayerContent readLayer(InputStream layer, Predicate<String> wanted) throws IOException {
    LayerContent content = new LayerContent(new LinkedHashMap<>(), new HashSet<>(), new HashSet<>());

    TarArchiveInputStream tarStream = new TarArchiveInputStream(uncompressed(layer));
    TarArchiveEntry entry;
    while ((entry = tarStream.getNextEntry()) != null) {
      String path = normalize(entry.getName());
      int slash = path.lastIndexOf('/');
      String directory = path.substring(0, slash + 1);
      String name = path.substring(slash + 1);

      if (name.equals(OPAQUE_MARKER)) {
        content.opaqueDirectories().add(directory);
        continue;
      }
      if (name.startsWith(WHITEOUT_PREFIX)) {
        content.removed().add(directory + name.substring(WHITEOUT_PREFIX.length()));
        continue;
      }
      if (entry.isFile() && wanted.test(path)) {
        content.files().put(path, tarStream.readAllBytes());
      }
    }

    return content;
  }

  private static boolean isHidden(String path, Set<String> removed, Set<String> opaqueDirectories) {
    for (String directory : opaqueDirectories) {
      if (path.startsWith(directory)) {
        return true;
      }
    }
    for (String removedPath : removed) {
      if (path.equals(removedPath) || path.startsWith(removedPath + "/")) {
        return true;
      }
    }
    return false;
  }

  /**
   * Strips the leading {@code ./} and {@code /} tar tools like to add.
   *
   * @param path the entry name
   * @return the normalized name
   */
  public static String normalize(String path) {
    String result = path;
    while (result.startsWith("./") || result.startsWith("/")) {
      result = result.startsWith("./") ? result.substring(2) : result.substring(1);
    }
    return result;
  }

  private static InputStream uncompressed(InputStream raw) throws IOException {
    InputStream stream = new BufferedInputStream(raw);
    byte[] magicBytes = new byte[4];
    stream.mark(4);
    int read = stream.readNBytes(magicBytes, 0, 4);
    stream.reset();
    if (read < 4) {
      return stream;
    }

    if ((magicBytes[0] & 0xFF) == 0x1F && (magicBytes[1] & 0xFF) == 0x8B) {
      return new GzipCompressorInputStream(stream, true);
    }
    // https://tools.ietf.org/html/rfc8478
    if (ByteBuffer.wrap(magicBytes).order(ByteOrder.LITTLE_ENDIAN).getInt() == ZSTD_MAGIC) {
      return new ZstdCompressorInputStream(stream);
    }
    return stream;
  }

  /**
   * What a single layer contributes.
   *
   * @param files the wanted files by normalized path
   * @param removed paths deleted by whiteouts in this layer
   * @param opaqueDirectories directories (with trailing slash, empty for the root) whose older content is hidden
   */
  private record LayerContent(Map<String, byte[]> files, Set<String> removed, Set<String> opaqueDirectories) {

  }
}
