package com.docqa.rag.service.sync.blob;

/**
 * Conditional write guard, modelled on object store generation preconditions.
 */
public record Precondition(Kind kind, long generation) {

    public enum Kind {
        NONE,
        IF_ABSENT,
        IF_GENERATION_MATCH
    }

    public static Precondition none() {
        return new Precondition(Kind.NONE, 0L);
    }

    public static Precondition ifAbsent() {
        return new Precondition(Kind.IF_ABSENT, 0L);
    }

    public static Precondition ifGenerationMatch(long generation) {
        return new Precondition(Kind.IF_GENERATION_MATCH, generation);
    }

    /**
     * @param currentGeneration generation of the stored blob, or {@code null} when there is none
     */
    public boolean isSatisfiedBy(Long currentGeneration) {
        return switch (kind) {
            case NONE -> true;
            case IF_ABSENT -> currentGeneration == null;
            case IF_GENERATION_MATCH -> currentGeneration != null && currentGeneration == generation;
        };
    }

    @Override
    public String toString() {
        return kind == Kind.IF_GENERATION_MATCH ? kind + "(" + generation + ")" : kind.name();
    }
}
