package com.dinoventures.economy.model;

/**
 * Federation scope of an {@link EconomyGroup}.
 */
public enum GroupKind {
    /** The one process-wide group every onboarded guild belongs to. */
    GLOBAL,
    /** Private group created for exactly one guild at onboarding. */
    SINGLE,
    /** Admin-created federation that several guilds may join. */
    LOCAL
}
