package io.github.eutro.rcopt.core.ops;

import io.github.eutro.rcopt.core.ext.ExtHolder;

/**
 * An operation key, representing a type of operation, without intermediates.
 * <p>
 * Properties shared by all operations of a type, such as purity, are attached to the key.
 */
public abstract class OpKey extends ExtHolder {
    /**
     * The printed name of the operation.
     */
    public final String mnemonic;

    /**
     * Construct an operation key.
     *
     * @param mnemonic The printed name.
     */
    public OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
