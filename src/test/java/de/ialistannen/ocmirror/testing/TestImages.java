package de.ialistannen.ocmirror.testing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;
import de.ialistannen.ocmirror.image.ManifestDocument;
import de.ialistannen.ocmirror.image.MediaTypes;
import de.ialistannen.ocmirror.image.Platform;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;

/**
 * Builds layers, configs and manifests for tests.
 */
public final class TestImages {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private TestImages() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * @param files file path to content, in archive order
   * @return an uncompressed tar archive
   */
  public static byte[] tar(Map<String, byte[]> files) {
    ByteArrayOutputStream result = new ByteArrayOutputStream();
    writeTar(files, result);
    return result.toByteArray();
  }

  /**
   * @param files file path to content, in archive order
   * @return a gzip compressed tar archive
   */
  public static byte[] tarGz(Map<String, byte[]> files) {
    ByteArrayOutputStream result = new ByteArrayOutputStream();
    try (GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(result)) {
      writeTar(files, gzip);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return result.toByteArray();
  }

  private static void writeTar(Map<String, byte[]> files, OutputStream target) {
    try {
      TarArchiveOutputStream tar = new TarArchiveOutputStream(target);
      tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
      for (Entry<String, byte[]> file : files.entrySet()) {
        TarArchiveEntry entry = new TarArchiveEntry(file.getKey());
        entry.setSize(file.getValue().length);
        tar.putArchiveEntry(entry);
        tar.write(file.getValue());
        tar.closeArchiveEntry();
      }
      tar.finish();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static byte[] utf8(String content) {
    return content.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * @param labels the image labels
   * @return an image config blob
   */
  public static byte[] config(Map<String, String> labels) {
    ObjectNode root = OBJECT_MAPPER.createObjectNode();
    root.put("architecture", "amd64");
    root.put("os", "linux");
    ObjectNode labelsNode = root.putObject("config").putObject("Labels");
    labels.forEach(labelsNode::put);
    return write(root);
  }

  /**
   * @param config the config blob digest
   * @param layers the layer digests, base layer first
   * @return a docker v2 image manifest
   */
  public static ManifestDocument imageManifest(BlobDigest config, List<BlobDigest> layers) {
    ObjectNode root = OBJECT_MAPPER.createObjectNode();
    root.put("schemaVersion", 2);
    root.put("mediaType", MediaTypes.DOCKER_MANIFEST_V2);
    ObjectNode configNode = root.putObject("config");
    configNode.put("mediaType", "application/vnd.docker.container.image.v1+json");
    configNode.put("digest", config.toString());
    ArrayNode layersNode = root.putArray("layers");
    for (BlobDigest layer : layers) {
      ObjectNode layerNode = layersNode.addObject();
      layerNode.put("mediaType", "application/vnd.docker.image.rootfs.diff.tar.gzip");
      layerNode.put("digest", layer.toString());
    }
    return ManifestDocument.parse(write(root), null);
  }

  /**
   * @param entries the manifests per platform
   * @return a docker v2 manifest list
   */
  public static ManifestDocument manifestList(Map<Platform, BlobDigest> entries) {
    ObjectNode root = OBJECT_MAPPER.createObjectNode();
    root.put("schemaVersion", 2);
    root.put("mediaType", MediaTypes.DOCKER_MANIFEST_LIST_V2);
    ArrayNode manifests = root.putArray("manifests");
    for (Entry<Platform, BlobDigest> entry : entries.entrySet()) {
      ObjectNode manifest = manifests.addObject();
      manifest.put("mediaType", MediaTypes.DOCKER_MANIFEST_V2);
      manifest.put("digest", entry.getValue().toString());
      ObjectNode platform = manifest.putObject("platform");
      platform.put("os", entry.getKey().os());
      platform.put("architecture", entry.getKey().architecture());
    }
    return ManifestDocument.parse(write(root), null);
  }

  /**
   * Uploads an image with the given labels and layers.
   *
   * @param registry the registry
   * @param reference where to put the image
   * @param labels the config labels
   * @param layers the layer blobs, base layer first
   * @return the reference, with the manifest digest
   */
  public static ImageReference pushImage(
    InMemoryRegistry registry,
    ImageReference reference,
    Map<String, String> labels,
    List<byte[]> layers
  ) {
    BlobDigest config = registry.putBlob(reference, config(labels));
    List<BlobDigest> layerDigests = new ArrayList<>();
    for (byte[] layer : layers) {
      layerDigests.add(registry.putBlob(reference, layer));
    }
    return registry.putManifest(reference, imageManifest(config, layerDigests));
  }

  private static byte[] write(ObjectNode node) {
    try {
      return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(node);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
