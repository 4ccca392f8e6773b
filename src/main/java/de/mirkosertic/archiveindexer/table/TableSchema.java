package de.mirkosertic.archiveindexer.table;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Optional record hooks of a table.
 *
 * @param validator    accepts or rejects a parsed record; {@code null} accepts everything
 * @param preprocessor transforms an accepted record; a {@code null}, missing or JSON-null
 *                     result keeps the original record
 */
public record TableSchema(@Nullable Predicate<JsonNode> validator,
                          @Nullable UnaryOperator<JsonNode> preprocessor) {

    private static final TableSchema NONE = new TableSchema(null, null);

    public static TableSchema none() {
        return NONE;
    }

    public boolean isValid(final JsonNode record) {
        return validator == null || validator.test(record);
    }

    public JsonNode preprocess(final JsonNode record) {
        if (preprocessor == null) {
            return record;
        }
        final JsonNode result = preprocessor.apply(record);
        if (result == null || result.isMissingNode() || result.isNull()) {
            return record;
        }
        return result;
    }
}
