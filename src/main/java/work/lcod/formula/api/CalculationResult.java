package work.lcod.formula.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.formula.runtime.ErrorCode;
import work.lcod.formula.runtime.FormulaException;
import work.lcod.formula.runtime.Values;

/**
 * Outcome of a {@link WorkbookCalculator} run (usable by the CLI and embedding apps).
 */
public record CalculationResult(
    Status status,
    List<String> order,
    Map<String, Object> values,
    Map<String, CellFailure> failures,
    CellFailure error,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public CalculationResult {
        order = List.copyOf(order);
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    static CalculationResult completed(
        List<String> order,
        Map<String, Object> values,
        Map<String, CellFailure> failures,
        Instant startedAt
    ) {
        Status status = failures.isEmpty() ? Status.SUCCESS : Status.PARTIAL;
        return new CalculationResult(status, order, values, failures, null, startedAt, Instant.now());
    }

    static CalculationResult failed(FormulaException ex, Instant startedAt) {
        return new CalculationResult(
            Status.FAILURE,
            List.of(),
            Map.of(),
            Map.of(),
            CellFailure.of(ex),
            startedAt,
            Instant.now()
        );
    }

    public Object value(String node) {
        return values.get(node);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("order", order);
        Map<String, Object> plainValues = new LinkedHashMap<>();
        values.forEach((node, value) -> plainValues.put(node, Values.isBlank(value) ? null : value));
        serializable.put("values", plainValues);
        if (!failures.isEmpty()) {
            Map<String, Object> plainFailures = new LinkedHashMap<>();
            failures.forEach((node, failure) -> plainFailures.put(node, failure.toMap()));
            serializable.put("failures", plainFailures);
        }
        if (error != null) {
            serializable.put("error", error.toMap());
        }
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    /** Failure recorded for one cell when the calculator runs in keep-going mode. */
    public record CellFailure(ErrorCode code, String message) {
        public static CellFailure of(FormulaException ex) {
            return new CellFailure(ex.code(), ex.getMessage());
        }

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("code", code.wireName());
            map.put("message", message);
            return map;
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1),
        PARTIAL(2);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
