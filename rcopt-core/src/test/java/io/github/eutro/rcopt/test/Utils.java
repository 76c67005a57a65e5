package io.github.eutro.rcopt.test;

import io.github.eutro.rcopt.core.ops.CommonOps;
import io.github.eutro.rcopt.core.ops.Op;
import io.github.eutro.rcopt.core.ops.OpKey;
import io.github.eutro.rcopt.core.ops.RcKind;
import io.github.eutro.rcopt.core.ops.RcOps;
import io.github.eutro.rcopt.core.ssa.*;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

import java.util.ArrayList;
import java.util.List;

public class Utils {
    public static final Handle CALLEE = new Handle(
            Opcodes.H_INVOKESTATIC,
            "test/Callee",
            "call",
            "(Ltest/Foo;)V",
            false
    );
    public static final Type FOO = Type.getObjectType("test/Foo");

    public static class FuncBuilder {
        public final Function func;
        public final IRBuilder ib;

        public FuncBuilder(String name) {
            func = new Function(name);
            ib = new IRBuilder(func, func.newBb());
        }

        public FuncBuilder() {
            this("test");
        }

        public BasicBlock newBb() {
            return func.newBb();
        }

        public void switchTo(BasicBlock bb) {
            ib.setBlock(bb);
        }

        public Var arg(int n) {
            return ib.insert(CommonOps.ARG.create(n).insn(), "arg" + n);
        }

        public Effect retain(Var v) {
            return ib.insert(RcOps.retain(v));
        }

        public Effect release(Var v) {
            return ib.insert(RcOps.release(v));
        }

        public Effect retainValue(Var v) {
            return ib.insert(RcOps.RETAIN_VALUE.insn(v));
        }

        public Effect releaseValue(Var v) {
            return ib.insert(RcOps.RELEASE_VALUE.insn(v));
        }

        public List<Var> begin(Var x) {
            return ib.insertMulti(RcOps.GUARANTEED_BEGIN.insn(x), "gv", "gt");
        }

        public Var beginTuple(Var x) {
            return ib.insert(RcOps.GUARANTEED_BEGIN.insn(x), "g");
        }

        public Var extract(int n, Var tuple) {
            return ib.insert(RcOps.extract(n, tuple), n == 0 ? "gv" : "gt");
        }

        public Effect end(Var token) {
            return ib.insert(RcOps.GUARANTEED_END.insn(token));
        }

        public Effect debug(Var v) {
            return ib.insert(RcOps.DEBUG_VALUE.insn(v));
        }

        public Effect apply(Var... args) {
            return ib.insert(RcOps.APPLY.create(CALLEE).insn(args));
        }

        public Var partialApply(Var... args) {
            return ib.insert(RcOps.PARTIAL_APPLY.create(CALLEE).insn(args), "closure");
        }

        public Effect store(Var ptr, Var value) {
            return ib.insert(RcOps.STORE.insn(ptr, value));
        }

        public Var load(Var ptr) {
            return ib.insert(RcOps.LOAD.insn(ptr), "loaded");
        }

        public Var cast(Var v) {
            return ib.insert(RcOps.UNCHECKED_REF_CAST.create(FOO).insn(v), "cast");
        }

        public Var alloc() {
            return ib.insert(RcOps.ALLOC_REF.create(FOO).insn(), "obj");
        }

        public void ret(Var... vars) {
            ib.insertCtrl(CommonOps.RETURN.insn(vars).jumpsTo());
        }

        public void trap(String message) {
            ib.insertCtrl(CommonOps.TRAP.create(message).insn().jumpsTo());
        }

        public void br(BasicBlock target) {
            ib.insertCtrl(Control.br(target));
        }

        public void brIf(Var cond, BasicBlock taken, BasicBlock fallthrough) {
            ib.insertCtrl(CommonOps.BR_IF.insn(cond).jumpsTo(taken, fallthrough));
        }
    }

    public static List<Insn> insns(Function func) {
        List<Insn> insns = new ArrayList<>();
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                insns.add(effect.insn());
            }
        }
        return insns;
    }

    public static List<OpKey> keys(BasicBlock block) {
        List<OpKey> keys = new ArrayList<>();
        for (Effect effect : block.getEffects()) {
            keys.add(effect.insn().op.key);
        }
        return keys;
    }

    public static long count(Function func, RcKind kind) {
        return insns(func).stream().filter(kind::is).count();
    }

    public static long count(Function func, Op op) {
        return insns(func).stream().filter(insn -> insn.op == op).count();
    }
}
