package io.github.eutro.rcopt.core.ssa;

import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ext.Ext;
import io.github.eutro.rcopt.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.Set;

/**
 * A variable, the result of an {@link Effect}.
 * <p>
 * Variables are compared by identity; the name is only for printing.
 */
public final class Var extends ExtHolder {
    /**
     * The name of the variable.
     */
    public final String name;
    /**
     * Distinguishes variables with the same name, if {@link Function#UNIQUE_VAR_NAMES} is set.
     */
    public final int index;

    Var(String name, int index) {
        this.name = name;
        this.index = index;
    }

    @Override
    public String toString() {
        return '%' + name + (index == 0 ? "" : "." + index);
    }

    // exts
    private Effect assignedAt = null;
    private Set<Insn> usedAt = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            return (T) assignedAt;
        }
        if (ext == CommonExts.USED_AT) {
            return (T) usedAt;
        }
        return super.getNullable(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = (Effect) value;
            return;
        }
        if (ext == CommonExts.USED_AT) {
            usedAt = (Set<Insn>) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = null;
            return;
        }
        if (ext == CommonExts.USED_AT) {
            usedAt = null;
            return;
        }
        super.removeExt(ext);
    }
}
