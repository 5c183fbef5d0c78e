package com.egress.proxy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateParserTest {

    private final CandidateParser parser = new CandidateParser(new ObjectMapper());

    @Test
    void parsesNewlineDelimitedRecords() {
        String body = """
                {"ip":"1.1.1.1","port":"8080"}
                {"ip":"2.2.2.2","port":3128,"username":"bob","password":"secret"}
                """;

        List<Candidate> candidates = parser.parseBatch(body);

        assertThat(candidates).containsExactly(
                Candidate.builder().host("1.1.1.1").port(8080).build(),
                Candidate.builder().host("2.2.2.2").port(3128).username("bob").password("secret").build());
        assertThat(candidates.get(1).hasCredentials()).isTrue();
    }

    @Test
    void skipsMalformedLinesAndRecordsWithoutHostOrPort() {
        String body = String.join("\n",
                "not json at all",
                "{\"ip\":\"3.3.3.3\"}",
                "{\"port\":\"80\"}",
                "{\"ip\":\"4.4.4.4\",\"port\":\"70000\"}",
                "{\"ip\":\"5.5.5.5\",\"port\":\"abc\"}",
                "",
                "{\"ip\":\"6.6.6.6\",\"port\":\"1080\"}");

        assertThat(parser.parseBatch(body))
                .extracting(Candidate::getHost)
                .containsExactly("6.6.6.6");
    }

    @Test
    void ignoresHalfCredentials() {
        List<Candidate> candidates = parser.parseBatch("{\"ip\":\"7.7.7.7\",\"port\":\"80\",\"username\":\"only-user\"}");

        assertThat(candidates).hasSize(1);
        assertThat(candidates.get(0).hasCredentials()).isFalse();
        assertThat(candidates.get(0).getUsername()).isNull();
    }

    @Test
    void emptyOrNullBodyYieldsNoCandidates() {
        assertThat(parser.parseBatch(null)).isEmpty();
        assertThat(parser.parseBatch("   \n  ")).isEmpty();
    }

    @Test
    void parsesTextualForms() {
        assertThat(parser.parse("1.2.3.4:8080")).contains(Candidate.builder().host("1.2.3.4").port(8080).build());
        assertThat(parser.parse("1.2.3.4:8080:user:pass"))
                .hasValueSatisfying(c -> {
                    assertThat(c.getUsername()).isEqualTo("user");
                    assertThat(c.getPassword()).isEqualTo("pass");
                });
        assertThat(parser.parse("1.2.3.4")).isEmpty();
        assertThat(parser.parse("1.2.3.4:0")).isEmpty();
        assertThat(parser.parse(":8080")).isEmpty();
        assertThat(parser.parse("1.2.3.4:8080:user")).isEmpty();
    }
}
