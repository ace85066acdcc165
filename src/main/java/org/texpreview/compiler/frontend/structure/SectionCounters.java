package org.texpreview.compiler.frontend.structure;

/**
 * Heading counters of one structural pass. Immutable: every numbered heading yields a new value.
 *
 * @param chapter    The top-level counter.
 * @param section    The mid-level counter, reset by each chapter.
 * @param subsection The low-level counter, reset by each chapter and section.
 */
public record SectionCounters(int chapter, int section, int subsection) {

    /**
     * @return Counters before the first heading.
     */
    public static SectionCounters initial() {
        return new SectionCounters(0, 0, 0);
    }

    /**
     * Steps the counter of a numbered heading level.
     * @param level The level of the heading just encountered.
     * @return The counters after the heading.
     * @throws IllegalArgumentException if the level is not numbered.
     */
    public SectionCounters advance(HeadingLevel level) {
        return switch (level) {
            case CHAPTER -> new SectionCounters(chapter + 1, 0, 0);
            case SECTION -> new SectionCounters(chapter, section + 1, 0);
            case SUBSECTION -> new SectionCounters(chapter, section, subsection + 1);
            default -> throw new IllegalArgumentException("Heading level is not numbered: " + level);
        };
    }

    /**
     * Formats the label of a heading at the given level. The chapter component is only present
     * once a numbered chapter has occurred.
     * @param level The level of the heading.
     * @return The label, e.g. {@code 2.1}.
     * @throws IllegalArgumentException if the level is not numbered.
     */
    public String label(HeadingLevel level) {
        String prefix = chapter > 0 ? chapter + "." : "";
        return switch (level) {
            case CHAPTER -> String.valueOf(chapter);
            case SECTION -> prefix + section;
            case SUBSECTION -> prefix + section + "." + subsection;
            default -> throw new IllegalArgumentException("Heading level is not numbered: " + level);
        };
    }
}
