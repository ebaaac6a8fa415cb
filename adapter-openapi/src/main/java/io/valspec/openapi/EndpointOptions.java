package io.valspec.openapi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-endpoint options. A {@code null} response schema or callback list means "use the binder
 * default"; an explicit value always wins over the default.
 *
 * @param summary          operation summary, empty if not given
 * @param responseSchema   name of the compiled schema documented as the 201 response, or null
 * @param callbackSchemas  names of compiled schemas documented as callbacks, or null
 * @param openApiOptions   extra operation keys merged verbatim into the rendered operation
 */
public record EndpointOptions(
        String summary, String responseSchema, List<String> callbackSchemas, Map<String, Object> openApiOptions) {

    public EndpointOptions {
        summary = summary == null ? "" : summary;
        callbackSchemas = callbackSchemas == null ? null : List.copyOf(callbackSchemas);
        openApiOptions = openApiOptions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(openApiOptions));
    }

    /** No summary, binder defaults for responses and callbacks. */
    public static EndpointOptions none() {
        return builder().build();
    }

    /** Options carrying only a summary. */
    public static EndpointOptions summary(String summary) {
        return builder().summary(summary).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private String summary = "";
        private String responseSchema;
        private List<String> callbackSchemas;
        private final Map<String, Object> openApiOptions = new LinkedHashMap<>();

        private Builder() {}

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder responseSchema(String responseSchema) {
            this.responseSchema = responseSchema;
            return this;
        }

        public Builder callbackSchema(String callbackSchema) {
            if (callbackSchemas == null) {
                callbackSchemas = new ArrayList<>();
            }
            callbackSchemas.add(callbackSchema);
            return this;
        }

        public Builder callbackSchemas(List<String> callbackSchemas) {
            this.callbackSchemas = new ArrayList<>(callbackSchemas);
            return this;
        }

        public Builder openApiOption(String key, Object value) {
            openApiOptions.put(key, value);
            return this;
        }

        public EndpointOptions build() {
            return new EndpointOptions(summary, responseSchema, callbackSchemas, openApiOptions);
        }
    }
}
