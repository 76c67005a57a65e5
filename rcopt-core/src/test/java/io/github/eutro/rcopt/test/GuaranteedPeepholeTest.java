package io.github.eutro.rcopt.test;

import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ext.MetadataState;
import io.github.eutro.rcopt.core.ops.CommonOps;
import io.github.eutro.rcopt.core.ops.RcKind;
import io.github.eutro.rcopt.core.ops.RcOps;
import io.github.eutro.rcopt.core.passes.meta.ComputeUses;
import io.github.eutro.rcopt.core.passes.meta.VerifyIntegrity;
import io.github.eutro.rcopt.core.passes.misc.ForPass;
import io.github.eutro.rcopt.core.passes.opts.GuaranteedPeephole;
import io.github.eutro.rcopt.core.ssa.*;
import io.github.eutro.rcopt.core.ssa.Module;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.rcopt.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class GuaranteedPeepholeTest {
    static boolean runPass(Function func) {
        boolean changed = GuaranteedPeephole.INSTANCE.removeGuaranteedPairs(func);
        ComputeUses.INSTANCE.then(VerifyIntegrity.INSTANCE).run(func);
        return changed;
    }

    static void assertUnchanged(FuncBuilder fb) {
        String before = fb.func.toString();
        assertFalse(runPass(fb.func));
        assertEquals(before, fb.func.toString());
    }

    static Var onlyArg(Effect effect) {
        List<Var> args = effect.insn().args();
        assertEquals(1, args.size());
        return args.get(0);
    }

    @Test
    void testSimpleScope() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        Effect call = fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        BasicBlock entry = fb.func.blocks.get(0);
        assertEquals(Arrays.asList(CommonOps.ARG, RcOps.APPLY), keys(entry));
        assertSame(x, onlyArg(call));
    }

    @Test
    void testSideEffectBeforeBegin() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        Var y = fb.arg(1);
        fb.retain(x);
        fb.apply(y);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertUnchanged(fb);
    }

    @Test
    void testStoreBeforeBegin() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        Var p = fb.arg(1);
        fb.retain(x);
        fb.store(p, x);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertUnchanged(fb);
    }

    @Test
    void testEndNotPostDominating() {
        FuncBuilder fb = new FuncBuilder();
        BasicBlock thenBb = fb.newBb();
        BasicBlock joinBb = fb.newBb();

        Var x = fb.arg(0);
        Var cond = fb.arg(1);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.brIf(cond, thenBb, joinBb);

        fb.switchTo(thenBb);
        fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.br(joinBb);

        fb.switchTo(joinBb);
        fb.ret();

        assertUnchanged(fb);
    }

    @Test
    void testEndPostDominatingAcrossBlocks() {
        FuncBuilder fb = new FuncBuilder();
        BasicBlock left = fb.newBb();
        BasicBlock right = fb.newBb();
        BasicBlock join = fb.newBb();

        Var x = fb.arg(0);
        Var cond = fb.arg(1);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.brIf(cond, left, right);

        fb.switchTo(left);
        Effect call = fb.apply(g.get(0));
        fb.br(join);

        fb.switchTo(right);
        fb.br(join);

        fb.switchTo(join);
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        assertEquals(Arrays.asList(CommonOps.ARG, CommonOps.ARG), keys(fb.func.blocks.get(0)));
        assertSame(x, onlyArg(call));
        assertEquals(Collections.emptyList(), keys(join));
    }

    @Test
    void testNestedPair() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.retain(g.get(0));
        Effect call = fb.apply(g.get(0));
        fb.release(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        assertEquals(Arrays.asList(CommonOps.ARG, RcOps.APPLY), keys(fb.func.blocks.get(0)));
        assertSame(x, onlyArg(call));
    }

    @Test
    void testNestedPairSeparatedByStore() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        Var p = fb.arg(1);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        Effect nestedRetain = fb.retain(x);
        fb.store(p, g.get(0));
        Effect nestedRelease = fb.release(x);
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        BasicBlock entry = fb.func.blocks.get(0);
        assertEquals(Arrays.asList(
                CommonOps.ARG,
                CommonOps.ARG,
                RcOps.STRONG_RETAIN.key,
                RcOps.STORE.key,
                RcOps.STRONG_RELEASE.key
        ), keys(entry));
        assertSame(nestedRetain, entry.getEffects().get(2));
        assertSame(nestedRelease, entry.getEffects().get(4));
        assertEquals(Arrays.asList(p, x), entry.getEffects().get(3).insn().args());
    }

    @Test
    void testNestedPairOfOtherValueKept() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        Var y = fb.arg(1);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.retain(y);
        fb.apply(g.get(0), y);
        fb.release(y);
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        assertEquals(1, count(fb.func, RcKind.RETAIN));
        assertEquals(1, count(fb.func, RcKind.RELEASE));
    }

    @Test
    void testTwoEnds() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertUnchanged(fb);
    }

    @Test
    void testNoEnd() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.release(x);
        fb.ret();

        assertUnchanged(fb);
    }

    @Test
    void testTokenUsedElsewhere() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0), g.get(1));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertUnchanged(fb);
    }

    @Test
    void testExtractedResults() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        Var tuple = fb.beginTuple(x);
        Var value = fb.extract(0, tuple);
        Var token = fb.extract(1, tuple);
        Effect call = fb.apply(value);
        fb.end(token);
        fb.release(value);
        fb.ret();

        assertTrue(runPass(fb.func));
        assertEquals(Arrays.asList(CommonOps.ARG, RcOps.APPLY), keys(fb.func.blocks.get(0)));
        assertSame(x, onlyArg(call));
    }

    @Test
    void testExtractedTupleRetainedAndReleased() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        Var tuple = fb.beginTuple(x);
        Var value = fb.extract(0, tuple);
        Var token = fb.extract(1, tuple);
        Effect tupleRetain = fb.retainValue(tuple);
        fb.apply(value);
        Effect tupleRelease = fb.releaseValue(tuple);
        fb.end(token);
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        assertEquals(Arrays.asList(
                CommonOps.ARG,
                RcOps.RETAIN_VALUE.key,
                RcOps.APPLY,
                RcOps.RELEASE_VALUE.key
        ), keys(fb.func.blocks.get(0)));
        assertSame(x, onlyArg(tupleRetain));
        assertSame(x, onlyArg(tupleRelease));
    }

    @Test
    void testDuplicateExtraction() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        Var tuple = fb.beginTuple(x);
        Var value = fb.extract(0, tuple);
        Var value2 = fb.extract(0, tuple);
        Var token = fb.extract(1, tuple);
        fb.apply(value, value2);
        fb.end(token);
        fb.release(x);
        fb.ret();

        assertUnchanged(fb);
    }

    @Test
    void testMissingTokenExtraction() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        Var tuple = fb.beginTuple(x);
        Var value = fb.extract(0, tuple);
        fb.apply(value);
        fb.release(x);
        fb.ret();

        assertUnchanged(fb);
    }

    @Test
    void testTupleEscapes() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        Var tuple = fb.beginTuple(x);
        Var value = fb.extract(0, tuple);
        Var token = fb.extract(1, tuple);
        fb.apply(value, tuple);
        fb.end(token);
        fb.release(x);
        fb.ret();

        assertUnchanged(fb);
    }

    @Test
    void testDebugUsesDeleted() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        Effect debugX = fb.debug(x);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.debug(g.get(0));
        fb.debug(g.get(1));
        fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        assertEquals(Arrays.asList(CommonOps.ARG, RcOps.DEBUG_VALUE.key, RcOps.APPLY), keys(fb.func.blocks.get(0)));
        assertSame(debugX, fb.func.blocks.get(0).getEffects().get(1));
    }

    @Test
    void testExtractedDebugUsesDeleted() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        Var tuple = fb.beginTuple(x);
        fb.debug(tuple);
        Var value = fb.extract(0, tuple);
        Var token = fb.extract(1, tuple);
        fb.debug(value);
        fb.debug(token);
        fb.apply(value);
        fb.end(token);
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        assertEquals(0, count(fb.func, RcKind.DEBUG));
        assertEquals(Arrays.asList(CommonOps.ARG, RcOps.APPLY), keys(fb.func.blocks.get(0)));
    }

    @Test
    void testReleaseBeforeEnd() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.release(g.get(0));
        fb.end(g.get(1));
        fb.ret();

        assertTrue(runPass(fb.func));
        assertEquals(Arrays.asList(CommonOps.ARG, RcOps.APPLY), keys(fb.func.blocks.get(0)));
    }

    @Test
    void testReleaseAfterEndPreferred() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        Effect before = fb.release(x);
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        BasicBlock entry = fb.func.blocks.get(0);
        assertEquals(Arrays.asList(
                CommonOps.ARG,
                RcOps.STRONG_RETAIN.key,
                RcOps.STRONG_RELEASE.key
        ), keys(entry));
        assertSame(before, entry.getEffects().get(2));
    }

    @Test
    void testReleaseSearchSkipsOtherReleases() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        Var y = fb.arg(1);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.end(g.get(1));
        Effect otherRelease = fb.release(y);
        fb.debug(y);
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        BasicBlock entry = fb.func.blocks.get(0);
        assertEquals(Arrays.asList(
                CommonOps.ARG,
                CommonOps.ARG,
                RcOps.APPLY,
                RcOps.STRONG_RELEASE.key,
                RcOps.DEBUG_VALUE.key
        ), keys(entry));
        assertSame(otherRelease, entry.getEffects().get(3));
    }

    @Test
    void testReleaseSearchBlocked() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        Var p = fb.arg(1);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.store(p, x);
        fb.release(x);
        fb.ret();

        assertUnchanged(fb);
    }

    @Test
    void testReleaseInOtherBlock() {
        FuncBuilder fb = new FuncBuilder();
        BasicBlock exit = fb.newBb();
        Var x = fb.arg(0);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.br(exit);

        fb.switchTo(exit);
        fb.release(x);
        fb.ret();

        assertUnchanged(fb);
    }

    @Test
    void testFillerBeforeBegin() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        Var y = fb.arg(1);
        fb.retain(x);
        Var yCast = fb.cast(y);
        fb.debug(x);
        fb.retain(yCast);
        Var loaded = fb.load(y);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0), loaded);
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        assertEquals(Arrays.asList(
                CommonOps.ARG,
                CommonOps.ARG,
                RcOps.UNCHECKED_REF_CAST,
                RcOps.DEBUG_VALUE.key,
                RcOps.STRONG_RETAIN.key,
                RcOps.LOAD.key,
                RcOps.APPLY
        ), keys(fb.func.blocks.get(0)));
    }

    @Test
    void testCastOperand() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        Var xCast = fb.cast(x);
        fb.retain(xCast);
        List<Var> g = fb.begin(xCast);
        Effect call = fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        assertEquals(Arrays.asList(CommonOps.ARG, RcOps.UNCHECKED_REF_CAST, RcOps.APPLY), keys(fb.func.blocks.get(0)));
        assertSame(xCast, onlyArg(call));
    }

    @Test
    void testNoRetain() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertUnchanged(fb);
    }

    @Test
    void testRetainOfOtherValue() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        Var y = fb.arg(1);
        fb.retain(y);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertUnchanged(fb);
    }

    @Test
    void testRetainInOtherBlock() {
        FuncBuilder fb = new FuncBuilder();
        BasicBlock body = fb.newBb();
        Var x = fb.arg(0);
        fb.retain(x);
        fb.br(body);

        fb.switchTo(body);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertUnchanged(fb);
    }

    @Test
    void testRetainAtBlockStart() {
        FuncBuilder fb = new FuncBuilder();
        BasicBlock body = fb.newBb();
        Var x = fb.arg(0);
        fb.br(body);

        fb.switchTo(body);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        Effect call = fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        assertEquals(Collections.singletonList(call), body.getEffects());
        assertSame(x, onlyArg(call));
    }

    @Test
    void testConsecutiveScopes() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        Var y = fb.arg(1);
        fb.retain(x);
        List<Var> gx = fb.begin(x);
        Effect callX = fb.apply(gx.get(0));
        fb.end(gx.get(1));
        fb.release(x);
        fb.retain(y);
        List<Var> gy = fb.begin(y);
        Effect callY = fb.apply(gy.get(0));
        fb.end(gy.get(1));
        fb.release(y);
        fb.ret();

        assertTrue(runPass(fb.func));
        assertEquals(Arrays.asList(CommonOps.ARG, CommonOps.ARG, RcOps.APPLY, RcOps.APPLY), keys(fb.func.blocks.get(0)));
        assertSame(x, onlyArg(callX));
        assertSame(y, onlyArg(callY));
    }

    @Test
    void testNestedScopes() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        fb.retain(x);
        List<Var> outer = fb.begin(x);
        List<Var> inner = fb.begin(outer.get(0));
        Effect call = fb.apply(inner.get(0));
        fb.end(inner.get(1));
        fb.release(outer.get(0));
        fb.end(outer.get(1));
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        assertEquals(0, count(fb.func, RcKind.RETAIN));
        assertEquals(0, count(fb.func, RcKind.RELEASE));
        assertEquals(0, count(fb.func, RcKind.GUARANTEED_BEGIN));
        assertEquals(0, count(fb.func, RcKind.GUARANTEED_END));
        assertSame(x, onlyArg(call));
    }

    @Test
    void testIdempotent() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        Var p = fb.arg(1);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.retain(x);
        fb.store(p, x);
        fb.release(x);
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        String once = fb.func.toString();
        assertFalse(runPass(fb.func));
        assertEquals(once, fb.func.toString());
    }

    @Test
    void testLaterScopeUnblocksEarlier() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        List<Var> g1 = fb.begin(x);
        fb.end(g1.get(1));
        fb.retain(x);
        List<Var> g2 = fb.begin(x);
        fb.end(g2.get(1));
        fb.release(x);
        fb.release(x);
        fb.ret();

        assertTrue(runPass(fb.func));
        assertEquals(0, count(fb.func, RcKind.RETAIN));
        assertEquals(0, count(fb.func, RcKind.RELEASE));
        assertEquals(0, count(fb.func, RcKind.GUARANTEED_BEGIN));
        assertEquals(0, count(fb.func, RcKind.GUARANTEED_END));
        assertFalse(runPass(fb.func));
    }

    @Test
    void testScopeInBlockThatNeverExits() {
        FuncBuilder fb = new FuncBuilder();
        BasicBlock spin = fb.newBb();
        Var x = fb.arg(0);
        fb.br(spin);
        fb.switchTo(spin);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.br(spin);

        assertTrue(runPass(fb.func));
        assertEquals(0, count(fb.func, RcKind.GUARANTEED_BEGIN));
        assertEquals(1, count(fb.func, RcKind.CALL));
    }

    @Test
    void testInvalidatesMetadata() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        MetadataState ms = fb.func.getExtOrThrow(CommonExts.METADATA_STATE);
        GuaranteedPeephole.INSTANCE.runInPlace(fb.func);
        assertFalse(ms.isValid(MetadataState.USES));
        assertFalse(ms.isValid(MetadataState.RC_IDENTITY));

        GuaranteedPeephole.INSTANCE.runInPlace(fb.func);
        assertTrue(ms.isValid(MetadataState.USES));
    }

    @Test
    void testCustomAnalyses() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        int[] postDomQueries = {0};
        GuaranteedPeephole pass = new GuaranteedPeephole(
                func -> v -> v,
                func -> (a, b) -> {
                    postDomQueries[0]++;
                    return false;
                }
        );
        assertFalse(pass.removeGuaranteedPairs(fb.func));
        assertEquals(1, postDomQueries[0]);
    }

    @Test
    void testPostDominanceNotComputedWithoutCandidates() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        fb.apply(x);
        fb.release(x);
        fb.ret();

        GuaranteedPeephole pass = new GuaranteedPeephole(
                func -> v -> v,
                func -> {
                    throw new AssertionError("post-dominance computed");
                }
        );
        assertFalse(pass.removeGuaranteedPairs(fb.func));
    }

    @Test
    void testChained() {
        FuncBuilder fb = new FuncBuilder();
        Var x = fb.arg(0);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();

        GuaranteedPeephole.INSTANCE
                .then(ComputeUses.INSTANCE)
                .then(VerifyIntegrity.INSTANCE)
                .run(fb.func);
        assertEquals(Arrays.asList(CommonOps.ARG, RcOps.APPLY), keys(fb.func.blocks.get(0)));
    }

    static Function scopeFunction(String name) {
        FuncBuilder fb = new FuncBuilder(name);
        Var x = fb.arg(0);
        fb.retain(x);
        List<Var> g = fb.begin(x);
        fb.apply(g.get(0));
        fb.end(g.get(1));
        fb.release(x);
        fb.ret();
        return fb.func;
    }

    @Test
    void testModule() {
        Module module = new Module();
        for (int i = 0; i < 4; i++) {
            module.functions.add(scopeFunction("f" + i));
        }
        ForPass.liftFunctions(GuaranteedPeephole.INSTANCE).run(module);
        for (Function func : module.functions) {
            assertEquals(Arrays.asList(CommonOps.ARG, RcOps.APPLY), keys(func.blocks.get(0)));
        }
    }

    @Test
    void testModuleParallel() {
        Module module = new Module();
        for (int i = 0; i < 32; i++) {
            module.functions.add(scopeFunction("f" + i));
        }
        ForPass.liftFunctionsParallel(GuaranteedPeephole.INSTANCE.then(VerifyIntegrity.INSTANCE)).run(module);
        for (Function func : module.functions) {
            assertEquals(0, count(func, RcKind.RETAIN));
            assertEquals(0, count(func, RcKind.GUARANTEED_BEGIN));
        }
    }
}
