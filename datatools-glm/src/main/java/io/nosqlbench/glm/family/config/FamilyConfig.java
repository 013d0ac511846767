package io.nosqlbench.glm.family.config;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.glm.family.Family;
import io.nosqlbench.glm.family.FamilyKind;
import io.nosqlbench.glm.family.NegativeBinomial;
import io.nosqlbench.glm.links.Link;
import io.nosqlbench.glm.links.Links;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON-serializable description of a family and its link.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "family": "negative_binomial",
 *   "link": "log",        // optional, defaults to the family's default link
 *   "alpha": 0.5          // optional, negative_binomial only
 * }
 * }</pre>
 *
 * <p>Family names are resolved by {@link FamilyKind#byName(String)} and link
 * names by {@link Links#byName(String)}. An alpha on any family other than
 * negative_binomial is rejected.
 *
 * @see FamilySpecParser
 */
public class FamilyConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @SerializedName("family")
    private String family;

    @SerializedName("link")
    private String link;

    @SerializedName("alpha")
    private Double alpha;

    public FamilyConfig() {
    }

    /**
     * @param family the family name
     * @param link the link name, or null for the default
     * @param alpha the dispersion, or null for the default
     */
    public FamilyConfig(String family, String link, Double alpha) {
        this.family = family;
        this.link = link;
        this.alpha = alpha;
    }

    /**
     * Describes an existing family.
     *
     * @param family the family
     * @return a config that rebuilds an equivalent family
     */
    public static FamilyConfig of(Family family) {
        Objects.requireNonNull(family, "family cannot be null");
        Double alpha = family instanceof NegativeBinomial ? ((NegativeBinomial) family).getAlpha() : null;
        return new FamilyConfig(family.name(), family.link().name(), alpha);
    }

    public String getFamily() {
        return family;
    }

    public String getLink() {
        return link;
    }

    public Double getAlpha() {
        return alpha;
    }

    /**
     * Builds the configured family.
     *
     * @return a new family instance
     * @throws IllegalArgumentException if the family or link name is unknown, alpha is
     *         given for a family without one, or the link is not allowed for the family
     */
    public Family toFamily() {
        if (family == null) {
            throw new IllegalArgumentException("Family config is missing the 'family' field");
        }
        FamilyKind kind = FamilyKind.byName(family);
        if (alpha != null && !kind.hasAlpha()) {
            throw new IllegalArgumentException("alpha is not a parameter of the " + kind.familyName() + " family");
        }
        Link resolved = link == null ? kind.defaultLink() : Links.byName(link);
        return kind.create(resolved, alpha == null ? NegativeBinomial.DEFAULT_ALPHA : alpha);
    }

    /**
     * Parses a config from JSON text.
     *
     * @param json the JSON text
     * @return the config
     * @throws JsonParseException if the text is not valid JSON
     */
    public static FamilyConfig fromJson(String json) {
        return requireContent(GSON.fromJson(json, FamilyConfig.class));
    }

    /**
     * Parses a config from a reader.
     *
     * @param reader the JSON source
     * @return the config
     */
    public static FamilyConfig fromJson(Reader reader) {
        return requireContent(GSON.fromJson(reader, FamilyConfig.class));
    }

    /**
     * Loads a config from a JSON file.
     *
     * @param path the file path
     * @return the config
     * @throws IOException if the file cannot be read
     */
    public static FamilyConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    private static FamilyConfig requireContent(FamilyConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Family config is empty");
        }
        return config;
    }

    /**
     * @return this config as pretty-printed JSON
     */
    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * Writes this config as JSON.
     *
     * @param writer the destination
     */
    public void toJson(Writer writer) {
        GSON.toJson(this, writer);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FamilyConfig)) return false;
        FamilyConfig that = (FamilyConfig) o;
        return Objects.equals(family, that.family)
            && Objects.equals(link, that.link)
            && Objects.equals(alpha, that.alpha);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, link, alpha);
    }

    @Override
    public String toString() {
        return "FamilyConfig[family=" + family + ", link=" + link + ", alpha=" + alpha + "]";
    }
}
