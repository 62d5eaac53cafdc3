package com.di.statsrollup.selector;

import com.di.statsrollup.config.RollupConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for the three container selection policies.
 */
@DisplayName("ContainerSelector Tests")
class ContainerSelectorTest {

    private static final String AGENT = "cadvisor";
    private static final String UUID_V1 = "a8098c1a-f86e-11da-bd1a-00112444be1e";

    @Nested
    @DisplayName("MatchAll")
    class MatchAll {

        private final ContainerSelector selector = new MatchAllSelector();

        @Test
        @DisplayName("Should pick the first name")
        void testFirstName() {
            assertEquals(Optional.of("web"), selector.select(List.of("web", "abc123")));
        }

        @Test
        @DisplayName("Should include the agent's own container")
        void testIncludesAgent() {
            assertEquals(Optional.of("k8s_cadvisor"), selector.select(List.of("k8s_cadvisor", AGENT)));
            assertEquals(Optional.of(AGENT), selector.select(List.of(AGENT)));
        }

        @Test
        @DisplayName("Should skip a container without names")
        void testNoNames() {
            assertTrue(selector.select(List.of()).isEmpty());
            assertTrue(selector.select(null).isEmpty());
        }

        @Test
        @DisplayName("Should take a blank first name as-is")
        void testBlankFirstName() {
            assertEquals(Optional.of(""), selector.select(List.of("", "web")));
            assertEquals(Optional.of(""), selector.select(List.of("")));
        }
    }

    @Nested
    @DisplayName("MatchAllExceptAgent")
    class MatchAllExceptAgent {

        private final ContainerSelector selector = new MatchAllExceptAgentSelector(AGENT);

        @Test
        @DisplayName("Should pick the first name of an ordinary container")
        void testOrdinary() {
            assertEquals(Optional.of("db"), selector.select(List.of("db", "f00d")));
        }

        @Test
        @DisplayName("Should skip a container that has the agent name anywhere in its names")
        void testSkipsAgent() {
            assertTrue(selector.select(List.of("some-id", AGENT)).isEmpty());
            assertTrue(selector.select(List.of(AGENT)).isEmpty());
        }

        @Test
        @DisplayName("Agent name should match exactly, not as a substring")
        void testExactMatch() {
            assertEquals(Optional.of("cadvisor-exporter"), selector.select(List.of("cadvisor-exporter")));
        }
    }

    @Nested
    @DisplayName("MatchByIdentifierFormat")
    class MatchByIdentifierFormat {

        private final ContainerSelector selector = new IdentifierFormatSelector(AGENT);

        @Test
        @DisplayName("Should accept a version-1 UUID name")
        void testAcceptsUuid() {
            assertEquals(Optional.of(UUID_V1), selector.select(List.of(UUID_V1)));
        }

        @Test
        @DisplayName("Should pick the first UUID among the names, skipping others")
        void testPicksUuidName() {
            assertEquals(Optional.of(UUID_V1), selector.select(List.of("customer-web", UUID_V1, "6fa459ea-ee8a-3ca4-894e-db77e160355e")));
        }

        @Test
        @DisplayName("Should reject non-UUID names")
        void testRejectsNonUuid() {
            assertTrue(selector.select(List.of("customer-web", "d7f8a1c2e3b4")).isEmpty());
        }

        @Test
        @DisplayName("Should reject the agent's own container even if it also has a UUID name")
        void testRejectsAgent() {
            assertTrue(selector.select(List.of(AGENT)).isEmpty());
            assertTrue(selector.select(List.of(UUID_V1, AGENT)).isEmpty());
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "a8098c1a-f86e-11da-bd1a-00112444be1e",
            "A8098C1A-F86E-11DA-BD1A-00112444BE1E",
            "a8098c1af86e11dabd1a00112444be1e",
            "{a8098c1a-f86e-11da-bd1a-00112444be1e}",
            "urn:uuid:a8098c1a-f86e-11da-bd1a-00112444be1e",
            "{a8098c1a-f86e-11da-bd1a-00112444be1e",
            "a8098c1a-f86e-11da-bd1a-00112444be1e}}",
            "uuid:urn:a8098c1a-f86e-11da-bd1a-00112444be1e",
            "a8098c1a-urn:f86e-11da-bd1a-00112444be1e"
        })
        @DisplayName("Should accept the UUID spellings a lenient UUID parser accepts")
        void testUuidSpellings(String candidate) {
            assertTrue(IdentifierFormatSelector.isUuid(candidate));
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "",
            "cadvisor",
            "a8098c1a-f86e-11da-bd1a-00112444be1",
            "a8098c1a-f86e-11da-bd1a-00112444be1e0",
            "g8098c1a-f86e-11da-bd1a-00112444be1e",
            "3f1c2b4e5d6a7b8c9d0e1f2a3b4c5d6e7f8091a2b3c4d5e6f7a8b9c0d1e2f3a4",
            "URN:UUID:a8098c1a-f86e-11da-bd1a-00112444be1e",
            " a8098c1a-f86e-11da-bd1a-00112444be1e ",
            "a8098c1a-f86e-{11da}-bd1a-00112444be1e"
        })
        @DisplayName("Should reject malformed identifiers")
        void testRejectsMalformed(String candidate) {
            assertFalse(IdentifierFormatSelector.isUuid(candidate));
        }
    }

    @Nested
    @DisplayName("MatchType")
    class MatchTypes {

        @ParameterizedTest
        @CsvSource({
            "ALL, ALL",
            "all, ALL",
            "NO_CADVISOR, NO_AGENT",
            "NO_AGENT, NO_AGENT",
            "UUID, UUID",
            " uuid , UUID",
            "SOMETHING_ELSE, ALL"
        })
        @DisplayName("Should parse configured match types")
        void testFromConfig(String value, MatchType expected) {
            assertEquals(expected, MatchType.fromConfig(value));
        }

        @Test
        @DisplayName("Blank match type should default to ALL")
        void testBlank() {
            assertEquals(MatchType.ALL, MatchType.fromConfig(null));
            assertEquals(MatchType.ALL, MatchType.fromConfig("  "));
        }

        @Test
        @DisplayName("Each match type should produce its own selector, testable side by side")
        void testFactory() {
            for (MatchType type : MatchType.values()) {
                assertEquals(type, RollupConfiguration.forMatchType(type, AGENT).getMatchType());
            }
            assertInstanceOf(MatchAllSelector.class, RollupConfiguration.forMatchType(MatchType.ALL, AGENT));
            assertInstanceOf(MatchAllExceptAgentSelector.class, RollupConfiguration.forMatchType(MatchType.NO_AGENT, AGENT));
            assertInstanceOf(IdentifierFormatSelector.class, RollupConfiguration.forMatchType(MatchType.UUID, AGENT));
        }
    }
}
