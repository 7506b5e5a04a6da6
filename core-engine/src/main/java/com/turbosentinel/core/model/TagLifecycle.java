package com.turbosentinel.core.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Tracks the lifecycle of one tag within one analysis run.
 *
 * <pre>
 * UNSCORED -&gt; CANDIDATE_GENERATED -&gt; {VERIFIED | REJECTED} -&gt; SCORED -&gt; {ACTIONABLE | SUPPRESSED}
 * </pre>
 *
 * <p>
 * Not thread-safe; each tag task owns its own instance.
 * </p>
 *
 * @since 1.0.0
 */
public final class TagLifecycle {

    private static final Map<TagLifecycleState, Set<TagLifecycleState>> ALLOWED =
            new EnumMap<>(TagLifecycleState.class);

    static {
        ALLOWED.put(TagLifecycleState.UNSCORED, EnumSet.of(TagLifecycleState.CANDIDATE_GENERATED));
        ALLOWED.put(TagLifecycleState.CANDIDATE_GENERATED,
                EnumSet.of(TagLifecycleState.VERIFIED, TagLifecycleState.REJECTED));
        ALLOWED.put(TagLifecycleState.VERIFIED, EnumSet.of(TagLifecycleState.SCORED));
        ALLOWED.put(TagLifecycleState.REJECTED, EnumSet.of(TagLifecycleState.SCORED));
        ALLOWED.put(TagLifecycleState.SCORED,
                EnumSet.of(TagLifecycleState.ACTIONABLE, TagLifecycleState.SUPPRESSED));
        ALLOWED.put(TagLifecycleState.ACTIONABLE, EnumSet.noneOf(TagLifecycleState.class));
        ALLOWED.put(TagLifecycleState.SUPPRESSED, EnumSet.noneOf(TagLifecycleState.class));
    }

    private final String tag;
    private TagLifecycleState state = TagLifecycleState.UNSCORED;

    public TagLifecycle(String tag) {
        this.tag = Objects.requireNonNull(tag, "tag must not be null");
    }

    public TagLifecycleState getState() {
        return state;
    }

    /**
     * Move to {@code next}.
     *
     * @param next target state
     * @throws IllegalStateException if the transition is not allowed
     */
    public void transitionTo(TagLifecycleState next) {
        Objects.requireNonNull(next, "next state must not be null");
        if (!ALLOWED.get(state).contains(next)) {
            throw new IllegalStateException(
                    "Illegal lifecycle transition for tag '" + tag + "': " + state + " -> " + next);
        }
        state = next;
    }
}
