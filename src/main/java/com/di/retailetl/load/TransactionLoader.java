package com.di.retailetl.load;

import com.di.retailetl.load.plan.LoadPlan;

/**
 * Writes a load plan to the target store.
 */
public interface TransactionLoader {

    /**
     * @param plan          rows to insert, in order
     * @param schemaVersion version tag stamped on written rows
     * @return number of transaction rows inserted
     */
    int load(LoadPlan plan, String schemaVersion);
}
