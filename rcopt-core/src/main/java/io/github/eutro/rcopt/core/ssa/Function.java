package io.github.eutro.rcopt.core.ssa;

import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ext.Ext;
import io.github.eutro.rcopt.core.ext.ExtHolder;
import io.github.eutro.rcopt.core.ext.MetadataState;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A function: a named list of {@link BasicBlock basic blocks} forming a control flow graph.
 */
public final class Function extends ExtHolder {
    /**
     * Whether colliding variable names should be numbered, so printed IR is unambiguous.
     */
    public static boolean UNIQUE_VAR_NAMES = System.getenv("RCOPT_UNIQUE_VAR_NAMES") != null;

    /**
     * The name of the function, for debugging.
     */
    public final String name;

    /**
     * The blocks of this function, in layout order. The first is the entry block.
     */
    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_FUNCTION, Function.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.removeExt(CommonExts.OWNING_FUNCTION);
        }
    };

    private final Map<String, Integer> varNames = UNIQUE_VAR_NAMES ? new HashMap<>() : null;

    /**
     * Construct an empty function.
     *
     * @param name The name of the function.
     */
    public Function(String name) {
        this.name = name;
    }

    /**
     * Construct an empty, anonymous function.
     */
    public Function() {
        this("<anon>");
    }

    /**
     * Create a new variable.
     *
     * @param name The name of the variable.
     * @return The variable.
     */
    public Var newVar(String name) {
        if (varNames == null) {
            return new Var(name, 0);
        }
        int index = varNames.merge(name, 1, Integer::sum) - 1;
        return new Var(name, index);
    }

    /**
     * Create a new basic block at the end of this function.
     *
     * @return The block.
     */
    public BasicBlock newBb() {
        BasicBlock bb = new BasicBlock();
        blocks.add(bb);
        return bb;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(name).append("() {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = null;
            return;
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
