package de.ialistannen.ocmirror.dump;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableSet;
import de.ialistannen.ocmirror.graph.ContentGraph;
import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;
import de.ialistannen.ocmirror.operator.OperatorMetadata;
import de.ialistannen.ocmirror.operator.OperatorRecord;
import de.ialistannen.ocmirror.release.ReleaseMetadata;
import de.ialistannen.ocmirror.signing.SignatureVerification;
import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map.Entry;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders resolved metadata as json for the {@code dump} command.
 */
public class MetadataLogger {

  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataLogger.class);

  private final ObjectMapper objectMapper;
  private final boolean sort;

  /**
   * @param sort whether to sort object keys and lists
   */
  public MetadataLogger(boolean sort) {
    this.objectMapper = new ObjectMapper().configure(JsonNodeFeature.WRITE_PROPERTIES_SORTED, sort);
    this.sort = sort;
  }

  public void log(ImageReference indexRef, ReleaseMetadata metadata) {
    write(indexRef, toJson(metadata));
  }

  public void log(ImageReference indexRef, OperatorMetadata metadata) {
    write(indexRef, toJson(metadata));
  }

  private void write(ImageReference indexRef, ObjectNode json) {
    LOGGER.info("Metadata for '{}':\n{}", indexRef, render(json));
  }

  /**
   * Pretty prints the json. Object keys are written in sorted order if sorting is enabled.
   *
   * @param json the json to render
   * @return the rendered json
   */
  public String render(ObjectNode json) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(json);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not render metadata", e);
    }
  }

  public ObjectNode toJson(ReleaseMetadata metadata) {
    ObjectNode root = objectMapper.createObjectNode();
    root.put("manifestDigest", metadata.manifestDigest().toString());
    addGraph(root, metadata.graph());
    root.put("rawImageReferences", metadata.rawImageReferences());
    root.put("rawReleaseMetadata", metadata.rawReleaseMetadata());
    addStrings(root.putArray("signatureStores"), metadata.signatureStores(), URI::toString);
    addStrings(root.putArray("signingKeys"), metadata.signingKeys(), Function.identity());
    addSignatures(root.putArray("signatures"), metadata.signatures());
    return root;
  }

  public ObjectNode toJson(OperatorMetadata metadata) {
    ObjectNode root = objectMapper.createObjectNode();
    root.put("indexDatabase", metadata.indexDatabasePath());
    root.put("indexDatabaseDigest", BlobDigest.of(metadata.indexDatabase()).toString());
    root.put("indexDatabaseSize", metadata.indexDatabase().length);
    root.put("manifestDigest", metadata.manifestDigest().toString());

    List<OperatorRecord> operators = new ArrayList<>(metadata.operators());
    if (sort) {
      operators.sort(Comparator.comparing(OperatorRecord::packageName));
    }
    ArrayNode operatorsNode = root.putArray("operators");
    for (OperatorRecord operator : operators) {
      ObjectNode node = operatorsNode.addObject();
      node.put("package", operator.packageName());
      node.put("channel", operator.channel());
      node.put("bundle", operator.bundleName());
      node.put("bundleImage", operator.bundleImage().toString());
      addStrings(node.putArray("relatedImages"), operator.relatedImages(), ImageReference::toString);
    }

    addGraph(root, metadata.graph());
    addStrings(root.putArray("signatureStores"), metadata.signatureStores(), URI::toString);
    addSignatures(root.putArray("signatures"), metadata.signatures());
    return root;
  }

  private void addGraph(ObjectNode root, ContentGraph graph) {
    ObjectNode blobs = root.putObject("blobs");
    for (Entry<BlobDigest, ImmutableSet<String>> blob : graph.blobs().entrySet()) {
      addStrings(blobs.putArray(blob.getKey().toString()), blob.getValue(), Function.identity());
    }

    ObjectNode manifests = root.putObject("manifests");
    for (Entry<ImageReference, String> manifest : graph.manifests().entrySet()) {
      manifests.put(manifest.getKey().toString(), manifest.getValue());
    }
  }

  private void addSignatures(ArrayNode target, List<SignatureVerification> signatures) {
    for (SignatureVerification signature : signatures) {
      ObjectNode node = target.addObject();
      node.put("url", signature.url() == null ? null : signature.url().toString());
      node.put("type", signature.type().label());
      node.put("valid", signature.valid());
      node.put("fingerprint", signature.fingerprint());
      node.put("keyId", signature.keyId());
      node.put("username", signature.username());
      node.put("trust", signature.trust().name());
      node.put("statusGpg", signature.statusGpg());
      node.put("statusAtomic", signature.statusAtomic());
      node.put("timestamp", signature.timestamp() == null ? null : signature.timestamp().toString());
      node.put("signer", signature.signerShort());
    }
  }

  private <T> void addStrings(ArrayNode target, Iterable<T> values, Function<T, String> toString) {
    List<String> strings = new ArrayList<>();
    values.forEach(value -> strings.add(toString.apply(value)));
    if (sort) {
      strings.sort(Comparator.naturalOrder());
    }
    strings.forEach(target::add);
  }
}
