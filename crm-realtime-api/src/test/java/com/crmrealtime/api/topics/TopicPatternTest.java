/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.crmrealtime.api.topics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TopicPatternTest {

    @ParameterizedTest
    @CsvSource({
        "deal.stage.updated, deal.stage.updated, true",
        "deal.stage.updated, deal.stage.created, false",
        "deal.stage.*, deal.stage.updated, true",
        "deal.stage.*, deal.stage, true",
        "deal.stage.*, deal.stage.updated.detail, true",
        "deal.stage.*, deal.stages.updated, false",
        "deal.stage.*, deal.created, false",
        "deal.*, deal.stage.updated, true",
        "deal.*, dealer.created, false",
        "deal.stage, deal.stage.updated, false",
        "timeline.*, deal.stage.updated, false"
    })
    void testMatches(String pattern, String eventType, boolean expected) {
        assertEquals(expected, TopicPattern.matches(pattern, eventType));
    }

    @Test
    void testMatchesAgreesWithDefinition() {
        String[] patterns = {"a.*", "a.b.*", "a.b", "a.b.c", "ab.*", "a"};
        String[] types = {"a", "a.b", "a.b.c", "ab", "ab.c", "a.bc", "b.a"};
        for (String p : patterns) {
            for (String t : types) {
                boolean expected =
                        p.equals(t)
                                || (p.endsWith(".*")
                                        && (t.startsWith(p.substring(0, p.length() - 2) + ".")
                                                || t.equals(p.substring(0, p.length() - 2))));
                assertEquals(expected, TopicPattern.matches(p, t), p + " vs " + t);
            }
        }
    }

    @Test
    void testWellFormedEventType() {
        assertTrue(TopicPattern.isWellFormedEventType("deal.stage.updated"));
        assertTrue(TopicPattern.isWellFormedEventType("crm_contact.record-1.created"));
        assertTrue(TopicPattern.isWellFormedEventType("deal"));
        assertFalse(TopicPattern.isWellFormedEventType(null));
        assertFalse(TopicPattern.isWellFormedEventType(""));
        assertFalse(TopicPattern.isWellFormedEventType("deal..updated"));
        assertFalse(TopicPattern.isWellFormedEventType(".deal"));
        assertFalse(TopicPattern.isWellFormedEventType("deal."));
        assertFalse(TopicPattern.isWellFormedEventType("deal.*"));
        assertFalse(TopicPattern.isWellFormedEventType("deal stage"));
    }

    @Test
    void testWellFormedPattern() {
        assertTrue(TopicPattern.isWellFormedPattern("deal.stage.*"));
        assertTrue(TopicPattern.isWellFormedPattern("deal.stage.updated"));
        assertFalse(TopicPattern.isWellFormedPattern("*"));
        assertFalse(TopicPattern.isWellFormedPattern(".*"));
        assertFalse(TopicPattern.isWellFormedPattern("deal.*.updated"));
        assertFalse(TopicPattern.isWellFormedPattern("deal*"));
        assertFalse(TopicPattern.isWellFormedPattern("deal.**"));
    }
}
