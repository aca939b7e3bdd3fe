package io.synthval.command.compare;

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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.synthval.stats.ValidationEngine;
import io.synthval.stats.model.NumericResponses;
import io.synthval.stats.model.OptionCounts;
import io.synthval.stats.model.QuestionResponses;
import io.synthval.stats.model.ResponseSet;
import io.synthval.stats.model.SurveyQuestion;
import io.synthval.stats.model.ValidationReport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Comparison input read from a JSON document.
///
/// Three shapes are accepted. A response value is either an array of numbers
/// (raw numeric responses) or an object of option label to count.
///
/// ```json
/// { "synthetic": [3, 4, 5], "real": [3, 5, 5] }
///
/// { "questions": [
///     { "question_id": "Q1", "question_name": "Satisfaction",
///       "synthetic": { "1": 42, "2": 33 }, "real": { "1": 40, "2": 35 } } ] }
///
/// { "synthetic_questions": [ { "question_id": "Q1", "responses": { "1": 42 } } ],
///   "real_questions":      [ { "question_id": "Q1", "response_counts": { "1": 40 } } ] }
/// ```
///
/// The first shape is compared as a whole. The second compares each listed
/// pair. The third pairs the two question lists by id first; `response_counts`
/// is accepted as another name for `responses`.
public final class ComparisonInput {

    private final ResponseSet synthetic;
    private final ResponseSet real;
    private final List<QuestionResponses> questions;
    private final List<SurveyQuestion> syntheticQuestions;
    private final List<SurveyQuestion> realQuestions;

    private ComparisonInput(ResponseSet synthetic, ResponseSet real, List<QuestionResponses> questions,
                            List<SurveyQuestion> syntheticQuestions, List<SurveyQuestion> realQuestions) {
        this.synthetic = synthetic;
        this.real = real;
        this.questions = questions;
        this.syntheticQuestions = syntheticQuestions;
        this.realQuestions = realQuestions;
    }

    /// Reads and parses an input file.
    ///
    /// @param path UTF-8 JSON file
    /// @return the parsed input
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if the document does not match any accepted shape
    public static ComparisonInput read(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /// Parses JSON text.
    ///
    /// @param json the document
    /// @return the parsed input
    /// @throws IllegalArgumentException if the document is malformed or does not match any accepted shape
    public static ComparisonInput parse(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("malformed JSON: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new IllegalArgumentException("input must be a JSON object");
        }
        JsonObject object = root.getAsJsonObject();

        if (object.has("questions")) {
            List<QuestionResponses> pairs = new ArrayList<>();
            for (JsonObject entry : objects(object, "questions")) {
                String id = questionId(entry);
                ResponseSet syn = optionalResponses(entry, "synthetic", id);
                ResponseSet rea = optionalResponses(entry, "real", id);
                if (syn == null && rea == null) {
                    throw new IllegalArgumentException("question " + id + " has neither synthetic nor real responses");
                }
                syn = syn == null ? rea.emptyOfSameKind() : syn;
                rea = rea == null ? syn.emptyOfSameKind() : rea;
                pairs.add(new QuestionResponses(id, name(entry), syn, rea));
            }
            return new ComparisonInput(null, null, pairs, null, null);
        }
        if (object.has("synthetic_questions") || object.has("real_questions")) {
            return new ComparisonInput(null, null, null,
                surveyQuestions(object, "synthetic_questions"), surveyQuestions(object, "real_questions"));
        }
        if (object.has("synthetic") && object.has("real")) {
            return new ComparisonInput(responses(object.get("synthetic"), "synthetic"),
                responses(object.get("real"), "real"), null, null, null);
        }
        throw new IllegalArgumentException(
            "input needs 'synthetic' and 'real', 'questions', or 'synthetic_questions' and 'real_questions'");
    }

    /// Runs the comparison that matches this input's shape.
    public ValidationReport evaluate(ValidationEngine engine) {
        if (questions != null) {
            return engine.compareQuestions(questions);
        }
        if (syntheticQuestions != null) {
            return engine.compareSurvey(syntheticQuestions, realQuestions);
        }
        return engine.compare(synthetic, real);
    }

    private static List<SurveyQuestion> surveyQuestions(JsonObject object, String key) {
        List<SurveyQuestion> list = new ArrayList<>();
        if (!object.has(key)) {
            return list;
        }
        for (JsonObject entry : objects(object, key)) {
            String id = questionId(entry);
            ResponseSet responses = optionalResponses(entry, "responses", id);
            if (responses == null) {
                responses = optionalResponses(entry, "response_counts", id);
            }
            if (responses == null) {
                throw new IllegalArgumentException("question " + id + " in " + key + " has no responses");
            }
            list.add(new SurveyQuestion(id, name(entry), responses));
        }
        return list;
    }

    private static List<JsonObject> objects(JsonObject object, String key) {
        JsonElement element = object.get(key);
        if (!element.isJsonArray()) {
            throw new IllegalArgumentException("'" + key + "' must be an array");
        }
        List<JsonObject> list = new ArrayList<>();
        for (JsonElement item : element.getAsJsonArray()) {
            if (!item.isJsonObject()) {
                throw new IllegalArgumentException("every entry of '" + key + "' must be an object");
            }
            list.add(item.getAsJsonObject());
        }
        return list;
    }

    private static String questionId(JsonObject entry) {
        JsonElement id = entry.get("question_id");
        if (id == null || id.isJsonNull() || !id.isJsonPrimitive()) {
            throw new IllegalArgumentException("question entry without a question_id");
        }
        return id.getAsString();
    }

    private static String name(JsonObject entry) {
        JsonElement name = entry.get("question_name");
        if (name == null || name.isJsonNull()) {
            return null;
        }
        if (!name.isJsonPrimitive() || !name.getAsJsonPrimitive().isString()) {
            throw new IllegalArgumentException("question_name of question " + questionId(entry) + " must be a string");
        }
        return name.getAsString();
    }

    private static ResponseSet optionalResponses(JsonObject entry, String key, String id) {
        JsonElement element = entry.get(key);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        return responses(element, id + "." + key);
    }

    private static ResponseSet responses(JsonElement element, String where) {
        if (element.isJsonArray()) {
            JsonArray array = element.getAsJsonArray();
            double[] values = new double[array.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = number(array.get(i), where + "[" + i + "]");
            }
            return NumericResponses.of(values);
        }
        if (element.isJsonObject()) {
            Map<String, Double> counts = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> e : element.getAsJsonObject().entrySet()) {
                counts.put(e.getKey(), number(e.getValue(), where + "." + e.getKey()));
            }
            return OptionCounts.of(counts);
        }
        throw new IllegalArgumentException(where + " must be an array of numbers or an object of counts");
    }

    private static double number(JsonElement element, String where) {
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new IllegalArgumentException("expected a number at " + where);
        }
        return element.getAsDouble();
    }
}
