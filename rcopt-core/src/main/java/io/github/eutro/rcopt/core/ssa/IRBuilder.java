package io.github.eutro.rcopt.core.ssa;

import java.util.ArrayList;
import java.util.List;

/**
 * An instruction builder, which appends instructions to the end of a block.
 */
public class IRBuilder {
    /**
     * The function being inserted into.
     */
    public final Function func;
    private BasicBlock bb;

    /**
     * Construct an instruction builder inserting into a block.
     *
     * @param func The function.
     * @param bb   One of the function's blocks.
     */
    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    /**
     * Get the block being inserted into.
     *
     * @return The block.
     */
    public BasicBlock getBlock() {
        return bb;
    }

    /**
     * Set the block to insert into.
     *
     * @param bb The block.
     */
    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    /**
     * Append an effect.
     *
     * @param effect The effect.
     * @return The same effect.
     */
    public Effect insert(Effect effect) {
        bb.addEffect(effect);
        return effect;
    }

    /**
     * Append an instruction whose results are discarded.
     *
     * @param insn The instruction.
     * @return The inserted effect.
     */
    public Effect insert(Insn insn) {
        return insert(insn.assignTo());
    }

    /**
     * Append an instruction, assigning its single result to a new variable.
     *
     * @param insn The instruction.
     * @param name The name of the variable.
     * @return The variable.
     */
    public Var insert(Insn insn, String name) {
        Var v = func.newVar(name);
        insert(insn.assignTo(v));
        return v;
    }

    /**
     * Append an instruction, assigning each of its results to a new variable.
     *
     * @param insn  The instruction.
     * @param names The names of the variables, one per result.
     * @return The variables.
     */
    public List<Var> insertMulti(Insn insn, String... names) {
        List<Var> vars = new ArrayList<>(names.length);
        for (String name : names) {
            vars.add(func.newVar(name));
        }
        insert(insn.assignTo(vars));
        return vars;
    }

    /**
     * Set the control instruction of the current block.
     *
     * @param ctrl The control instruction.
     */
    public void insertCtrl(Control ctrl) {
        bb.setControl(ctrl);
    }
}
