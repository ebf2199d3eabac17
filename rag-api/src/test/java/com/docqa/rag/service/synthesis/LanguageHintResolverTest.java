package com.docqa.rag.service.synthesis;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageHintResolverTest {

    private final LanguageHintResolver resolver = new LanguageHintResolver();

    @Test
    void detectsLatinLanguagesFromStopWords() {
        assertThat(resolver.detect("What is the submission deadline?")).isEqualTo("en");
        assertThat(resolver.detect("Wann ist der Abgabetermin für die Arbeit?")).isEqualTo("de");
        assertThat(resolver.detect("Quelle est la date limite pour les dossiers ?")).isEqualTo("fr");
    }

    @Test
    void detectsNonLatinScripts() {
        assertThat(resolver.detect("마감일은 언제입니까?")).isEqualTo("ko");
        assertThat(resolver.detect("締め切りはいつですか？")).isEqualTo("ja");
        assertThat(resolver.detect("Когда крайний срок?")).isEqualTo("ru");
    }

    @Test
    void explicitOverrideWins() {
        assertThat(resolver.resolve("What is the deadline?", " DE ")).isEqualTo("de");
        assertThat(resolver.resolve("What is the deadline?", null)).isEqualTo("en");
    }

    @Test
    void unknownInputFallsBackToDefault() {
        assertThat(resolver.detect("")).isEqualTo(LanguageHintResolver.DEFAULT_LANGUAGE);
        assertThat(resolver.detect("12345 ???")).isEqualTo("en");
        assertThat(resolver.notFoundMessage("xx")).isEqualTo("The answer could not be found in the document.");
        assertThat(resolver.languageName("de")).isEqualTo("German");
    }
}
