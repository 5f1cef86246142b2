package work.lcod.formula.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.formula.model.GridSplitter;
import work.lcod.formula.model.Sheet;
import work.lcod.formula.model.SheetCatalog;

/**
 * Loads a serialized sheet catalog: a JSON/YAML document keyed by sheet name, or a directory of
 * CSV grids (one sheet per {@code .csv} file).
 */
public final class CatalogLoader {
    private static final Logger LOG = LoggerFactory.getLogger(CatalogLoader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private CatalogLoader() {}

    public static SheetCatalog load(Path path) {
        if (Files.isDirectory(path)) {
            return loadCsvDirectory(path);
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = name.endsWith(".yaml") || name.endsWith(".yml") ? YAML_MAPPER : JSON_MAPPER;
        try (var in = Files.newInputStream(path)) {
            return fromTree(mapper.readTree(in));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read catalog: " + path, ex);
        }
    }

    public static SheetCatalog fromJson(String json) {
        try {
            return fromTree(JSON_MAPPER.readTree(json));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid catalog JSON: " + ex.getMessage(), ex);
        }
    }

    public static SheetCatalog fromYaml(String yaml) {
        try {
            return fromTree(YAML_MAPPER.readTree(yaml));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid catalog YAML: " + ex.getMessage(), ex);
        }
    }

    public static SheetCatalog loadCsvDirectory(Path directory) {
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                .filter(file -> file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to list catalog directory: " + directory, ex);
        }
        var builder = SheetCatalog.builder();
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            String sheetName = fileName.substring(0, fileName.length() - ".csv".length());
            builder.sheet(sheetName, GridSplitter.split(readCsvGrid(file)));
        }
        LOG.debug("Loaded {} CSV sheets from {}", files.size(), directory);
        return builder.build();
    }

    private static List<List<Object>> readCsvGrid(Path file) {
        try (CSVParser parser = CSVParser.parse(file, StandardCharsets.UTF_8, CSVFormat.DEFAULT)) {
            List<List<Object>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                List<Object> row = new ArrayList<>(record.size());
                for (String cell : record) {
                    row.add(csvValue(cell));
                }
                rows.add(row);
            }
            return rows;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read CSV sheet: " + file, ex);
        }
    }

    static Object csvValue(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        if (raw.startsWith("=")) {
            return raw;
        }
        String trimmed = raw.trim();
        if ("TRUE".equalsIgnoreCase(trimmed)) {
            return Boolean.TRUE;
        }
        if ("FALSE".equalsIgnoreCase(trimmed)) {
            return Boolean.FALSE;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException ex) {
            return raw;
        }
    }

    private static SheetCatalog fromTree(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return SheetCatalog.empty();
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Catalog must be an object keyed by sheet name");
        }
        var builder = SheetCatalog.builder();
        var fields = root.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            builder.sheet(entry.getKey(), toSheet(entry.getKey(), entry.getValue()));
        }
        return builder.build();
    }

    private static Sheet toSheet(String name, JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Sheet " + name + " must be an object");
        }
        Map<String, Object> formulasRaw = toMap(node.get("formulas"));
        Map<String, String> formulas = new LinkedHashMap<>();
        formulasRaw.forEach((address, text) -> {
            if (!(text instanceof String str)) {
                throw new IllegalArgumentException("Formula " + name + "!" + address + " must be text");
            }
            formulas.put(address, str);
        });
        Map<String, Object> calculated = toMap(node.get("calculated"));
        if (node.hasNonNull("constants")) {
            Map<String, Object> constants = toMap(node.get("constants"));
            Map<String, Object> data = node.hasNonNull("data") ? toMap(node.get("data")) : new LinkedHashMap<>(constants);
            formulas.forEach(data::putIfAbsent);
            return new Sheet(data, constants, formulas, calculated);
        }
        return Sheet.of(toMap(node.get("data")), formulas, calculated);
    }

    private static Map<String, Object> toMap(JsonNode node) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return map;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Expected an object of cells but got: " + node);
        }
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            map.put(entry.getKey(), scalar(entry.getValue()));
        }
        return map;
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>();
            for (var item : node) {
                list.add(scalar(item));
            }
            return list;
        }
        throw new IllegalArgumentException("Unsupported cell value: " + node);
    }
}
