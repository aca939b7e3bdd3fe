package io.synthval.stats.model;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * One question's responses from a single survey source (synthetic or real).
 *
 * @param questionId question identifier
 * @param questionName display name, may be null
 * @param responses the responses
 */
public record SurveyQuestion(String questionId, String questionName, ResponseSet responses) {

    public SurveyQuestion {
        Objects.requireNonNull(questionId, "questionId cannot be null");
        Objects.requireNonNull(responses, "responses cannot be null");
    }

    /**
     * Pairs synthetic and real questions by id.
     *
     * <p>Ids are visited in sorted order over the union of both sides. The name
     * comes from the synthetic side when it has one, else from the real side. A
     * question present on one side only is paired with an empty response set
     * of the same kind, so it surfaces as insufficient data instead of
     * silently disappearing.
     *
     * @param synthetic questions from the synthetic source
     * @param real questions from the real source
     * @return one pair per distinct question id
     * @throws IllegalArgumentException if an id repeats within one side
     */
    public static List<QuestionResponses> pairById(List<SurveyQuestion> synthetic, List<SurveyQuestion> real) {
        Map<String, SurveyQuestion> syn = index(synthetic, "synthetic");
        Map<String, SurveyQuestion> rea = index(real, "real");

        List<QuestionResponses> pairs = new ArrayList<>();
        for (String id : new TreeSet<>(union(syn, rea))) {
            SurveyQuestion s = syn.get(id);
            SurveyQuestion r = rea.get(id);
            ResponseSet sResponses = s != null ? s.responses() : r.responses().emptyOfSameKind();
            ResponseSet rResponses = r != null ? r.responses() : s.responses().emptyOfSameKind();
            String name = s != null && s.questionName() != null && !s.questionName().isBlank()
                ? s.questionName()
                : r != null ? r.questionName() : null;
            pairs.add(new QuestionResponses(id, name, sResponses, rResponses));
        }
        return pairs;
    }

    private static Map<String, SurveyQuestion> index(List<SurveyQuestion> questions, String side) {
        Map<String, SurveyQuestion> byId = new TreeMap<>();
        for (SurveyQuestion q : questions) {
            if (byId.put(q.questionId(), q) != null) {
                throw new IllegalArgumentException("duplicate " + side + " question id: " + q.questionId());
            }
        }
        return byId;
    }

    private static List<String> union(Map<String, SurveyQuestion> a, Map<String, SurveyQuestion> b) {
        List<String> ids = new ArrayList<>(a.keySet());
        ids.addAll(b.keySet());
        return ids;
    }
}
