package com.risk.fta.api;

/**
 * A node of the fault tree.
 *
 * Identity:
 * Every event has a unique id within its registry. Ids are case-insensitive:
 * the id is the lower-cased form of the declared name, while {@link #name()}
 * keeps the original spelling for messages and reports.
 *
 * Events never hold references to their parents. Gates keep forward lists of
 * child ids only; any parent lookup is derived by a separate pass over those
 * lists.
 */
public interface Event {

    /**
     * Returns the normalized (lower-case) identifier.
     *
     * @return The id used for all lookups.
     */
    String id();

    /**
     * Returns the name as originally declared.
     *
     * @return The display name.
     */
    String name();

    /**
     * Returns the variant tag of this event.
     *
     * @return The kind.
     */
    EventKind kind();
}
