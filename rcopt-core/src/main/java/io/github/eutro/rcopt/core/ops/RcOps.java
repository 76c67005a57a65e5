package io.github.eutro.rcopt.core.ops;

import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ext.RcExts;
import io.github.eutro.rcopt.core.ssa.Insn;
import io.github.eutro.rcopt.core.ssa.Var;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Type;

/**
 * {@link Op}s and {@link OpKey}s of reference counted code.
 * <p>
 * Each key carries its {@link RcExts#RC_KIND kind}; see {@link RcKind#of(Insn)}.
 */
public class RcOps {
    /**
     * Effect: increments the strong reference count of its argument. Returns nothing.
     */
    public static final Op STRONG_RETAIN = new SimpleOpKey("strong_retain").create();
    /**
     * Effect: increments the reference counts held by a value of any type. Returns nothing.
     */
    public static final Op RETAIN_VALUE = new SimpleOpKey("retain_value").create();
    /**
     * Effect: decrements the strong reference count of its argument,
     * possibly deallocating it. Returns nothing.
     */
    public static final Op STRONG_RELEASE = new SimpleOpKey("strong_release").create();
    /**
     * Effect: decrements the reference counts held by a value of any type. Returns nothing.
     */
    public static final Op RELEASE_VALUE = new SimpleOpKey("release_value").create();

    /**
     * Effect: asserts that its argument stays alive until the matching
     * {@link #GUARANTEED_END}. Returns its argument and a scope token,
     * either as two results, or as one tuple result to be {@link #EXTRACT extracted}.
     */
    public static final Op GUARANTEED_BEGIN = new SimpleOpKey("unsafe_guaranteed").create();
    /**
     * Effect: ends the guaranteed scope of the token it is given. Returns nothing.
     */
    public static final Op GUARANTEED_END = new SimpleOpKey("unsafe_guaranteed_end").create();

    /**
     * Effect: returns the {@code n}th element of its tuple argument.
     */
    public static final UnaryOpKey<Integer> EXTRACT = new UnaryOpKey<>("tuple_extract");
    /**
     * Effect: records its argument for debuggers. Returns nothing.
     */
    public static final Op DEBUG_VALUE = new SimpleOpKey("debug_value").create();

    /**
     * Effect: calls the function, with the given arguments.
     */
    public static final UnaryOpKey<Handle> APPLY = new UnaryOpKey<>("apply", RcOps::printHandle);
    /**
     * Effect: returns a closure over the function and the given arguments.
     */
    public static final UnaryOpKey<Handle> PARTIAL_APPLY = new UnaryOpKey<>("partial_apply", RcOps::printHandle);

    /**
     * Effect: reinterprets its reference argument as the given type, unchecked.
     */
    public static final UnaryOpKey<Type> UNCHECKED_REF_CAST = new UnaryOpKey<>("unchecked_ref_cast", Type::getInternalName);
    /**
     * Effect: converts its reference argument to a supertype.
     */
    public static final UnaryOpKey<Type> UPCAST = new UnaryOpKey<>("upcast", Type::getInternalName);
    /**
     * Effect: allocates a new object of the given type, with a reference count of one.
     */
    public static final UnaryOpKey<Type> ALLOC_REF = new UnaryOpKey<>("alloc_ref", Type::getInternalName);
    /**
     * Effect: returns the value stored at its argument.
     */
    public static final Op LOAD = new SimpleOpKey("load").create();
    /**
     * Effect: stores its second argument at its first. Returns nothing.
     */
    public static final Op STORE = new SimpleOpKey("store").create();

    static {
        STRONG_RETAIN.key.attachExt(RcExts.RC_KIND, RcKind.RETAIN);
        RETAIN_VALUE.key.attachExt(RcExts.RC_KIND, RcKind.RETAIN);
        STRONG_RELEASE.key.attachExt(RcExts.RC_KIND, RcKind.RELEASE);
        RELEASE_VALUE.key.attachExt(RcExts.RC_KIND, RcKind.RELEASE);
        GUARANTEED_BEGIN.key.attachExt(RcExts.RC_KIND, RcKind.GUARANTEED_BEGIN);
        GUARANTEED_END.key.attachExt(RcExts.RC_KIND, RcKind.GUARANTEED_END);
        EXTRACT.attachExt(RcExts.RC_KIND, RcKind.EXTRACT);
        DEBUG_VALUE.key.attachExt(RcExts.RC_KIND, RcKind.DEBUG);
        APPLY.attachExt(RcExts.RC_KIND, RcKind.CALL);
        PARTIAL_APPLY.attachExt(RcExts.RC_KIND, RcKind.CALL);

        for (OpKey key : new OpKey[]{
                EXTRACT,
                UNCHECKED_REF_CAST,
                UPCAST,
                LOAD.key,
        }) {
            CommonExts.markPure(key);
        }
        UNCHECKED_REF_CAST.attachExt(RcExts.IS_RC_IDENTITY_PRESERVING, true);
        UPCAST.attachExt(RcExts.IS_RC_IDENTITY_PRESERVING, true);
    }

    private static String printHandle(Handle handle) {
        return handle.getOwner() + "." + handle.getName() + handle.getDesc();
    }

    /**
     * Return an instruction retaining {@code v}.
     *
     * @param v The value.
     * @return The instruction.
     */
    public static Insn retain(Var v) {
        return STRONG_RETAIN.insn(v);
    }

    /**
     * Return an instruction releasing {@code v}.
     *
     * @param v The value.
     * @return The instruction.
     */
    public static Insn release(Var v) {
        return STRONG_RELEASE.insn(v);
    }

    /**
     * Return an instruction extracting element {@code n} of {@code tuple}.
     *
     * @param n     The index.
     * @param tuple The tuple.
     * @return The instruction.
     */
    public static Insn extract(int n, Var tuple) {
        return EXTRACT.create(n).insn(tuple);
    }
}
