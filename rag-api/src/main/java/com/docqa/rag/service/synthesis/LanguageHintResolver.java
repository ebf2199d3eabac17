package com.docqa.rag.service.synthesis;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Guesses the language of a question so the answer can be written in it. Non-Latin scripts decide
 * directly; Latin text is scored against short stop-word lists.
 */
@Component
public class LanguageHintResolver {

    public static final String DEFAULT_LANGUAGE = "en";

    private static final Map<Character.UnicodeScript, String> SCRIPTS = new EnumMap<>(Character.UnicodeScript.class);

    static {
        SCRIPTS.put(Character.UnicodeScript.HANGUL, "ko");
        SCRIPTS.put(Character.UnicodeScript.HIRAGANA, "ja");
        SCRIPTS.put(Character.UnicodeScript.KATAKANA, "ja");
        SCRIPTS.put(Character.UnicodeScript.HAN, "zh");
        SCRIPTS.put(Character.UnicodeScript.CYRILLIC, "ru");
        SCRIPTS.put(Character.UnicodeScript.ARABIC, "ar");
        SCRIPTS.put(Character.UnicodeScript.GREEK, "el");
        SCRIPTS.put(Character.UnicodeScript.HEBREW, "he");
        SCRIPTS.put(Character.UnicodeScript.DEVANAGARI, "hi");
        SCRIPTS.put(Character.UnicodeScript.THAI, "th");
    }

    // Insertion order breaks ties.
    private static final Map<String, Set<String>> STOP_WORDS = new LinkedHashMap<>();

    static {
        STOP_WORDS.put("en", Set.of("the", "is", "are", "what", "when", "where", "which", "who", "how", "of",
                "and", "to", "in", "does", "do", "for", "this", "that", "with"));
        STOP_WORDS.put("de", Set.of("der", "die", "das", "ist", "sind", "was", "wann", "wo", "wie", "und", "nicht",
                "ein", "eine", "mit", "für", "welche", "den", "dem"));
        STOP_WORDS.put("fr", Set.of("le", "la", "les", "est", "sont", "quel", "quelle", "quand", "où", "comment",
                "et", "des", "du", "une", "pour", "dans", "qui", "que"));
        STOP_WORDS.put("es", Set.of("el", "la", "los", "las", "es", "son", "qué", "cuál", "cuándo", "dónde", "cómo",
                "y", "del", "una", "para", "por", "con", "que"));
        STOP_WORDS.put("it", Set.of("il", "lo", "la", "gli", "le", "è", "sono", "che", "quale", "quando", "dove",
                "come", "e", "del", "della", "una", "per", "con"));
        STOP_WORDS.put("pt", Set.of("o", "a", "os", "as", "é", "são", "qual", "quando", "onde", "como", "e", "do",
                "da", "uma", "para", "com", "não", "que"));
    }

    private static final Map<String, String> LANGUAGE_NAMES = Map.ofEntries(
            Map.entry("en", "English"), Map.entry("de", "German"), Map.entry("fr", "French"),
            Map.entry("es", "Spanish"), Map.entry("it", "Italian"), Map.entry("pt", "Portuguese"),
            Map.entry("ko", "Korean"), Map.entry("ja", "Japanese"), Map.entry("zh", "Chinese"),
            Map.entry("ru", "Russian"), Map.entry("ar", "Arabic"), Map.entry("el", "Greek"),
            Map.entry("he", "Hebrew"), Map.entry("hi", "Hindi"), Map.entry("th", "Thai"));

    private static final Map<String, String> NOT_FOUND_MESSAGES = Map.ofEntries(
            Map.entry("en", "The answer could not be found in the document."),
            Map.entry("de", "Die Antwort wurde im Dokument nicht gefunden."),
            Map.entry("fr", "La réponse est introuvable dans le document."),
            Map.entry("es", "No se encontró la respuesta en el documento."),
            Map.entry("it", "La risposta non è stata trovata nel documento."),
            Map.entry("pt", "A resposta não foi encontrada no documento."),
            Map.entry("ko", "문서에서 답변을 찾을 수 없습니다."),
            Map.entry("ja", "文書内に回答が見つかりませんでした。"),
            Map.entry("zh", "在文档中找不到答案。"),
            Map.entry("ru", "Ответ в документе не найден."));

    /**
     * Uses {@code override} when given, otherwise detects from the question.
     */
    public String resolve(String question, String override) {
        if (override != null && !override.isBlank()) {
            return override.trim().toLowerCase(Locale.ROOT);
        }
        return detect(question);
    }

    public String detect(String question) {
        if (question == null || question.isBlank()) {
            return DEFAULT_LANGUAGE;
        }
        Map<String, Integer> scriptVotes = new LinkedHashMap<>();
        int latin = 0;
        boolean kana = false;
        for (int i = 0; i < question.length(); ) {
            int codePoint = question.codePointAt(i);
            i += Character.charCount(codePoint);
            if (!Character.isLetter(codePoint)) {
                continue;
            }
            Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
            if (script == Character.UnicodeScript.LATIN) {
                latin++;
                continue;
            }
            if (script == Character.UnicodeScript.HIRAGANA || script == Character.UnicodeScript.KATAKANA) {
                kana = true;
            }
            String language = SCRIPTS.get(script);
            if (language != null) {
                scriptVotes.merge(language, 1, Integer::sum);
            }
        }
        if (kana) {
            return "ja";
        }
        String dominant = null;
        int votes = 0;
        for (Map.Entry<String, Integer> entry : scriptVotes.entrySet()) {
            if (entry.getValue() > votes) {
                dominant = entry.getKey();
                votes = entry.getValue();
            }
        }
        if (dominant != null && votes >= latin) {
            return dominant;
        }
        return detectLatin(question);
    }

    public String languageName(String language) {
        return LANGUAGE_NAMES.getOrDefault(language, language);
    }

    public String notFoundMessage(String language) {
        return NOT_FOUND_MESSAGES.getOrDefault(language, NOT_FOUND_MESSAGES.get(DEFAULT_LANGUAGE));
    }

    private String detectLatin(String question) {
        String[] words = question.toLowerCase(Locale.ROOT).split("[^\\p{L}]+");
        String best = DEFAULT_LANGUAGE;
        int bestScore = 0;
        for (Map.Entry<String, Set<String>> entry : STOP_WORDS.entrySet()) {
            int score = 0;
            for (String word : words) {
                if (entry.getValue().contains(word)) {
                    score++;
                }
            }
            if (score > bestScore) {
                best = entry.getKey();
                bestScore = score;
            }
        }
        return best;
    }
}
