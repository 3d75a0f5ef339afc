package io.b2mash.remodel.engine;

import io.b2mash.remodel.estimate.Category;
import io.b2mash.remodel.estimate.Settings;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/** SHA-256 over the JSON form of an estimate snapshot. Equal content gives an equal key. */
class InputFingerprint {

  private static final Logger log = LoggerFactory.getLogger(InputFingerprint.class);

  private final ObjectMapper objectMapper;

  InputFingerprint(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /** Returns empty when the snapshot cannot be serialized; such inputs are never cached. */
  Optional<String> of(List<Category> categories, Settings settings) {
    try {
      byte[] json = objectMapper.writeValueAsBytes(new Snapshot(categories, settings));
      return Optional.of(HexFormat.of().formatHex(sha256().digest(json)));
    } catch (JacksonException e) {
      log.warn("Estimate snapshot is not serializable, results will not be cached", e);
      return Optional.empty();
    }
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  record Snapshot(List<Category> categories, Settings settings) {}
}
