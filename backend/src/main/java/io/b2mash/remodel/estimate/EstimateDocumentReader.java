package io.b2mash.remodel.estimate;

import io.b2mash.remodel.calculation.CalculationIssue;
import io.b2mash.remodel.exception.ConsistencyException;
import io.b2mash.remodel.exception.ValidationException;
import io.b2mash.remodel.measurement.MeasurementType;
import io.b2mash.remodel.payment.PaymentRecord;
import io.b2mash.remodel.payment.PaymentType;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Reads stored estimate documents, including ones written by older versions, into the canonical
 * model.
 *
 * <p>Legacy shapes handled here:
 *
 * <ul>
 *   <li>{@code items} instead of {@code workItems}
 *   <li>{@code materialCost}/{@code laborCost} as the per-unit cost names
 *   <li>flat {@code sqft}/{@code width}/{@code height}/{@code linearFt}/{@code units} on the work
 *       item instead of a {@code surfaces} list
 *   <li>payments without a {@code type}
 *   <li>a deposit kept only as {@code paymentDetails.depositAmount}
 *   <li>an estimate-wide {@code settings.wasteFactor} instead of waste entries
 * </ul>
 */
@Component
public class EstimateDocumentReader {

  private static final Logger log = LoggerFactory.getLogger(EstimateDocumentReader.class);

  static final String MIGRATED_DEPOSIT_NOTE = "Initial deposit (migrated)";

  private static final List<String> FLAT_MEASUREMENT_FIELDS =
      List.of("sqft", "width", "height", "linearFt", "units");

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public EstimateDocumentReader(ObjectMapper objectMapper, Clock clock) {
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * @throws ValidationException when the text is not a JSON object
   * @throws ConsistencyException when the document records more than one deposit
   */
  public EstimateDocument read(String json) {
    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JacksonException e) {
      throw new ValidationException(
          "Invalid estimate document", "Estimate document is not valid JSON: " + e.getMessage());
    }
    if (root == null || !root.isObject()) {
      throw new ValidationException(
          "Invalid estimate document", "Estimate document must be a JSON object");
    }

    var warnings = new ArrayList<CalculationIssue>();
    List<Category> categories = readCategories(root.path("categories"), warnings);

    JsonNode settingsNode = root.path("settings");
    List<PaymentRecord> payments = readPayments(settingsNode.path("payments"), warnings);
    payments = migrateDeposit(root, payments, warnings);

    long deposits = payments.stream().filter(PaymentRecord::isDepositLike).count();
    if (deposits > 1) {
      throw new ConsistencyException(
          "Duplicate deposit",
          "Estimate document records " + deposits + " deposits; at most one is allowed");
    }

    Settings settings =
        new Settings(
            decimal(settingsNode.path("taxRate")),
            decimal(settingsNode.path("markup")),
            decimal(settingsNode.path("laborDiscount")),
            decimal(settingsNode.path("transportationFee")),
            readMiscFees(settingsNode.path("miscFees")),
            readWasteEntries(settingsNode.path("wasteEntries")),
            decimal(settingsNode.path("wasteFactor")),
            payments);
    return new EstimateDocument(categories, settings, warnings);
  }

  private List<Category> readCategories(JsonNode node, List<CalculationIssue> warnings) {
    var categories = new ArrayList<Category>();
    if (!node.isArray()) {
      return categories;
    }
    for (JsonNode categoryNode : node) {
      if (!categoryNode.isObject()) {
        categories.add(null);
        continue;
      }
      JsonNode itemsNode = categoryNode.path("workItems");
      if (!itemsNode.isArray()) {
        itemsNode = categoryNode.path("items");
      }
      var workItems = new ArrayList<WorkItem>();
      if (itemsNode.isArray()) {
        for (JsonNode itemNode : itemsNode) {
          workItems.add(itemNode.isObject() ? readWorkItem(itemNode, warnings) : null);
        }
      }
      categories.add(
          new Category(
              text(categoryNode.path("key")), text(categoryNode.path("name")), workItems));
    }
    return categories;
  }

  private WorkItem readWorkItem(JsonNode node, List<CalculationIssue> warnings) {
    String customName = text(node.path("customWorkTypeName"));
    if (customName == null) {
      customName = text(node.path("name"));
    }
    String rawType = text(node.path("measurementType"));
    MeasurementType measurementType = rawType == null ? null : MeasurementType.normalize(rawType);

    var surfaces = new ArrayList<Surface>();
    JsonNode surfacesNode = node.path("surfaces");
    if (surfacesNode.isArray()) {
      for (JsonNode surfaceNode : surfacesNode) {
        surfaces.add(surfaceNode.isObject() ? readSurface(surfaceNode) : null);
      }
    }

    boolean hasFlatFields = FLAT_MEASUREMENT_FIELDS.stream().anyMatch(node::has);
    if (hasFlatFields) {
      if (surfaces.isEmpty()) {
        surfaces.add(readSurface(node).withName("Surface 1"));
        warnings.add(
            CalculationIssue.of(
                "LEGACY_MEASUREMENTS_MIGRATED",
                "Flat measurement fields moved into a surface",
                Map.of("item", displayName(customName, node))));
      } else {
        log.debug("Discarding flat measurement fields on '{}'", displayName(customName, node));
        warnings.add(
            CalculationIssue.of(
                "LEGACY_MEASUREMENTS_DISCARDED",
                "Flat measurement fields ignored because surfaces are present",
                Map.of("item", displayName(customName, node))));
      }
    }

    BigDecimal materialRate = decimal(node.path("materialCostPerUnit"));
    if (materialRate == null) {
      materialRate = decimal(node.path("materialCost"));
    }
    BigDecimal laborRate = decimal(node.path("laborCostPerUnit"));
    if (laborRate == null) {
      laborRate = decimal(node.path("laborCost"));
    }

    return new WorkItem(
        text(node.path("type")),
        text(node.path("subtype")),
        customName,
        measurementType,
        materialRate,
        laborRate,
        surfaces,
        text(node.path("description")));
  }

  private Surface readSurface(JsonNode node) {
    return new Surface(
        text(node.path("name")),
        decimal(node.path("sqft")),
        decimal(node.path("width")),
        decimal(node.path("height")),
        decimal(node.path("linearFt")),
        decimal(node.path("units")),
        decimal(node.path("wasteFactor")));
  }

  private List<PaymentRecord> readPayments(JsonNode node, List<CalculationIssue> warnings) {
    var payments = new ArrayList<PaymentRecord>();
    if (!node.isArray()) {
      return payments;
    }
    for (JsonNode paymentNode : node) {
      if (!paymentNode.isObject()) {
        warnings.add(CalculationIssue.of("INVALID_PAYMENT", "Skipped a malformed payment entry"));
        continue;
      }
      String method = text(paymentNode.path("method"));
      String note = text(paymentNode.path("note"));
      PaymentType type = paymentType(text(paymentNode.path("type")), method, note);
      boolean installment = type == PaymentType.INSTALLMENT;
      boolean paid =
          type == PaymentType.DEPOSIT
              || bool(paymentNode.path("isPaid"))
              || "paid".equalsIgnoreCase(text(paymentNode.path("status")));

      payments.add(
          new PaymentRecord(
              id(paymentNode.path("id")),
              date(paymentNode.path("date")),
              decimal(paymentNode.path("amount")),
              method,
              note,
              paid,
              type,
              installment ? integer(paymentNode.path("installmentNumber")) : null,
              installment ? integer(paymentNode.path("totalInstallments")) : null,
              installment && bool(paymentNode.path("manuallyAdjusted"))));
    }
    return payments;
  }

  private List<PaymentRecord> migrateDeposit(
      JsonNode root, List<PaymentRecord> payments, List<CalculationIssue> warnings) {
    BigDecimal depositAmount = decimal(root.path("paymentDetails").path("depositAmount"));
    if (depositAmount == null || depositAmount.signum() <= 0) {
      return payments;
    }

    var migrated = new ArrayList<>(payments);
    for (int i = 0; i < migrated.size(); i++) {
      PaymentRecord payment = migrated.get(i);
      if (payment.isDepositLike()) {
        if (payment.date() == null) {
          migrated.set(
              i,
              payment.withDetails(
                  depositDate(root), payment.amount(), payment.method(), payment.note()));
        }
        return migrated;
      }
    }

    LocalDate date = depositDate(root);
    log.info("Migrating deposit of {} dated {} into the payments list", depositAmount, date);
    migrated.add(
        0,
        new PaymentRecord(
            UUID.randomUUID(),
            date,
            depositAmount,
            PaymentRecord.DEPOSIT_METHOD,
            MIGRATED_DEPOSIT_NOTE,
            true,
            PaymentType.DEPOSIT,
            null,
            null,
            false));
    warnings.add(
        CalculationIssue.of(
            "DEPOSIT_MIGRATED",
            "Deposit amount moved into the payments list",
            Map.of("amount", depositAmount, "date", date)));
    return migrated;
  }

  // depositDate, then the project start date, then the creation date, then today
  private LocalDate depositDate(JsonNode root) {
    for (JsonNode candidate :
        List.of(
            root.path("paymentDetails").path("depositDate"),
            root.path("customerInfo").path("startDate"),
            root.path("createdAt"))) {
      LocalDate date = date(candidate);
      if (date != null) {
        return date;
      }
    }
    return LocalDate.now(clock);
  }

  private static PaymentType paymentType(String raw, String method, String note) {
    if (raw != null) {
      PaymentType explicit =
          switch (raw.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "")) {
            case "deposit" -> PaymentType.DEPOSIT;
            case "installment" -> PaymentType.INSTALLMENT;
            case "onetime" -> PaymentType.ONE_TIME;
            default -> null;
          };
      if (explicit != null) {
        return explicit;
      }
      log.warn("Unknown payment type '{}', inferring from method and note", raw);
    }
    return PaymentRecord.isDepositLabel(method, note) ? PaymentType.DEPOSIT : PaymentType.ONE_TIME;
  }

  private static List<MiscFee> readMiscFees(JsonNode node) {
    var fees = new ArrayList<MiscFee>();
    if (node.isArray()) {
      for (JsonNode fee : node) {
        fees.add(new MiscFee(text(fee.path("name")), decimal(fee.path("amount"))));
      }
    }
    return fees;
  }

  private static List<WasteEntry> readWasteEntries(JsonNode node) {
    var entries = new ArrayList<WasteEntry>();
    if (node.isArray()) {
      for (JsonNode entry : node) {
        entries.add(
            new WasteEntry(
                text(entry.path("surfaceName")),
                decimal(entry.path("surfaceCost")),
                decimal(entry.path("wasteFactor"))));
      }
    }
    return entries;
  }

  private static String displayName(String customName, JsonNode node) {
    if (customName != null) {
      return customName;
    }
    String type = text(node.path("type"));
    return type != null ? type : "Unnamed Work Item";
  }

  private static String text(JsonNode node) {
    if (node.isMissingNode() || node.isNull()) {
      return null;
    }
    String value = node.asText();
    return value.isBlank() ? null : value;
  }

  private static boolean bool(JsonNode node) {
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    return "true".equalsIgnoreCase(text(node));
  }

  /** Numbers and numeric strings such as "$1,200.50"; anything else reads as missing. */
  static BigDecimal decimal(JsonNode node) {
    if (node.isMissingNode() || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return node.decimalValue();
    }
    String cleaned = node.asText().replaceAll("[^0-9.\\-]", "");
    if (cleaned.isEmpty()) {
      return null;
    }
    try {
      return new BigDecimal(cleaned);
    } catch (NumberFormatException e) {
      log.debug("Ignoring non-numeric value '{}'", node.asText());
      return null;
    }
  }

  private static Integer integer(JsonNode node) {
    BigDecimal value = decimal(node);
    return value == null ? null : value.intValue();
  }

  private static LocalDate date(JsonNode node) {
    String value = text(node);
    if (value == null || value.length() < 10) {
      return null;
    }
    try {
      return LocalDate.parse(value.substring(0, 10));
    } catch (DateTimeParseException e) {
      log.debug("Ignoring unparseable date '{}'", value);
      return null;
    }
  }

  private static UUID id(JsonNode node) {
    String value = text(node);
    if (value != null) {
      try {
        return UUID.fromString(value);
      } catch (IllegalArgumentException e) {
        log.debug("Replacing non-UUID payment id '{}'", value);
      }
    }
    return UUID.randomUUID();
  }
}
