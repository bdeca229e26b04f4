package com.heatlite.aggregator.budget;

/**
 * States of the size-budget loop.
 *
 * <pre>
 * AGGREGATING -> MEASURING -> ACCEPTED -> DONE
 *                          -> COARSENING -> AGGREGATING
 *                                        -> ACCEPTED (floor reached, oversized result kept)
 * </pre>
 */
public enum BudgetState {
    AGGREGATING,
    MEASURING,
    COARSENING,
    ACCEPTED,
    DONE
}
