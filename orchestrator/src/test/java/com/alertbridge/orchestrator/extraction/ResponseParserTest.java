package com.alertbridge.orchestrator.extraction;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ResponseParser is pure string handling, so no mocks and no Spring context.
 */
class ResponseParserTest {

    // ------------------------------------------------------------------
    // extractResult
    // ------------------------------------------------------------------

    @Test
    void extractResult_withTag_returnsTrimmedContent() {
        String response = "Here you go.\n<result>\n  {\"title\": \"x\"}\n</result>";
        assertThat(ResponseParser.extractResult(response)).contains("{\"title\": \"x\"}");
    }

    @Test
    void extractResult_withoutTag_returnsEmpty() {
        assertThat(ResponseParser.extractResult("no tag here")).isEmpty();
        assertThat(ResponseParser.extractResult(null)).isEmpty();
    }

    // ------------------------------------------------------------------
    // extractJsonObject
    // ------------------------------------------------------------------

    @Test
    void extractJsonObject_prefersResultTagOverFence() {
        String response = """
                ```json
                {"title": "from fence"}
                ```
                <result>{"title": "from tag"}</result>
                """;
        assertThat(ResponseParser.extractJsonObject(response)).contains("{\"title\": \"from tag\"}");
    }

    @Test
    void extractJsonObject_fencedBlock() {
        String response = """
                Sure:
                ```json
                {"title": "Crash", "description": "d", "labels": ["bug"]}
                ```
                """;
        assertThat(ResponseParser.extractJsonObject(response))
                .contains("{\"title\": \"Crash\", \"description\": \"d\", \"labels\": [\"bug\"]}");
    }

    @Test
    void extractJsonObject_bareObjectInProse() {
        String response = "The ticket is {\"title\": \"Crash\"} as requested.";
        assertThat(ResponseParser.extractJsonObject(response)).contains("{\"title\": \"Crash\"}");
    }

    @Test
    void extractJsonObject_noObject_returnsEmpty() {
        assertThat(ResponseParser.extractJsonObject("I could not find anything.")).isEmpty();
        assertThat(ResponseParser.extractJsonObject("} backwards {")).isEmpty();
        assertThat(ResponseParser.extractJsonObject("")).isEmpty();
    }
}
