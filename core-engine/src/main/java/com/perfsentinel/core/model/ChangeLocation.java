package com.perfsentinel.core.model;

/**
 * Side of a change point on which the commit that introduced the shift is
 * searched for.
 *
 * <p>
 * E-Divisive rarely lands on the exact commit, partly because not every
 * commit is measured. The value at the reported index is compared with the
 * means of the stretches behind and ahead of it; the side whose mean it is
 * further from is where the shift most likely happened.
 * </p>
 *
 * @since 1.0.0
 */
public enum ChangeLocation {

    /** The shift happened before the reported index. */
    BEHIND,

    /** The shift happened at or after the reported index. */
    AHEAD
}
