package dev.pagestack.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.github.difflib.text.DiffRow;
import com.github.difflib.text.DiffRowGenerator;
import dev.pagestack.util.JsonNormalizer;
import dev.pagestack.util.JsonNormalizer.DifferenceSummary;
import dev.pagestack.util.JsonNormalizer.JsonChange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Compares two snapshot documents. Both sides are key-sorted first so property order never
 * shows up as a change; the line based formats work on the pretty-printed sorted text.
 */
@Service
@Slf4j
public class VersionDiffService {

    private static final int CONTEXT_LINES = 3;

    private final DiffRowGenerator rowGenerator = DiffRowGenerator.create()
            .showInlineDiffs(false)
            .lineNormalizer(line -> line)
            .build();

    /**
     * @return a unified diff string, a list of {@link SideBySideRow}, a list of
     *         {@link PatchOperation} or a {@link DifferenceSummary}, depending on {@code format}
     */
    public Object diff(JsonNode oldDocument, JsonNode newDocument, DiffFormat format, String oldLabel, String newLabel) {
        return switch (format) {
            case UNIFIED -> unified(oldDocument, newDocument, oldLabel, newLabel);
            case SIDE_BY_SIDE -> sideBySide(oldDocument, newDocument);
            case JSON_PATCH -> jsonPatch(oldDocument, newDocument);
            case SUMMARY -> JsonNormalizer.differenceSummary(oldDocument, newDocument);
        };
    }

    public String unified(JsonNode oldDocument, JsonNode newDocument, String oldLabel, String newLabel) {
        List<String> oldLines = lines(oldDocument);
        List<String> newLines = lines(newDocument);
        Patch<String> patch = DiffUtils.diff(oldLines, newLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        return String.join("\n", UnifiedDiffUtils.generateUnifiedDiff(oldLabel, newLabel, oldLines, patch, CONTEXT_LINES));
    }

    public List<SideBySideRow> sideBySide(JsonNode oldDocument, JsonNode newDocument) {
        List<DiffRow> rows = rowGenerator.generateDiffRows(lines(oldDocument), lines(newDocument));
        List<SideBySideRow> result = new ArrayList<>(rows.size());
        for (DiffRow row : rows) {
            result.add(new SideBySideRow(row.getTag().name().toLowerCase(Locale.ROOT), row.getOldLine(), row.getNewLine()));
        }
        return result;
    }

    /**
     * RFC 6902 style operations derived from the change summary. Type changes become
     * {@code replace}.
     */
    public List<PatchOperation> jsonPatch(JsonNode oldDocument, JsonNode newDocument) {
        DifferenceSummary summary = JsonNormalizer.differenceSummary(oldDocument, newDocument);
        List<PatchOperation> operations = new ArrayList<>(summary.changes().size());
        for (JsonChange change : summary.changes()) {
            String path = pointer(change.path());
            operations.add(switch (change.type()) {
                case ADDITION -> new PatchOperation("add", path, change.value());
                case REMOVAL -> new PatchOperation("remove", path, null);
                case VALUE_CHANGE, TYPE_CHANGE -> new PatchOperation("replace", path, change.newValue());
            });
        }
        return operations;
    }

    static String pointer(String dotPath) {
        return "/" + dotPath.replace('.', '/');
    }

    private static List<String> lines(JsonNode document) {
        return Arrays.asList(JsonNormalizer.pretty(document).split("\\R", -1));
    }

    public record SideBySideRow(String tag, String oldLine, String newLine) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PatchOperation(String op, String path, JsonNode value) {
    }
}
