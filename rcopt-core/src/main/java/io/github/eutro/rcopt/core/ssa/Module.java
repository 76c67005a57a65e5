package io.github.eutro.rcopt.core.ssa;

import io.github.eutro.rcopt.core.ext.ExtHolder;

import java.util.ArrayList;
import java.util.List;

/**
 * A compilation unit: the functions that a driver schedules passes over.
 */
public final class Module extends ExtHolder {
    /**
     * The functions of the module. Each function is owned by this module alone.
     */
    public final List<Function> functions = new ArrayList<>();
}
