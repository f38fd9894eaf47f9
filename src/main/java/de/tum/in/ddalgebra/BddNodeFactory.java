/*
 * This file is part of JBDD (https://github.com/incaseoftrouble/jbdd).
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.ddalgebra;

import java.util.Map;
import javax.annotation.Nullable;

/**
 * The algebra of binary decision diagram nodes. All recursive calls go back through the bound
 * {@link DdOperations}, which take care of caching and canonicity.
 */
public class BddNodeFactory implements DdNodeFactory<BddNode> {
    private static final int LEAF_LEVEL = Integer.MAX_VALUE;

    @Nullable
    private DdOperations<BddNode> manager;

    @Override
    public void bind(DdOperations<BddNode> operations) {
        Util.checkState(manager == null, "Factory already bound to %s", manager);
        this.manager = operations;
    }

    private DdOperations<BddNode> manager() {
        DdOperations<BddNode> manager = this.manager;
        Util.checkState(manager != null, "Factory is not bound to a manager");
        return manager;
    }

    /**
     * The standard "apply" recursion, descending on the smaller top variable.
     */
    @Override
    public DdIndex and(DdIndex xid, BddNode x, DdIndex yid, BddNode y) {
        assert !xid.isConstant() && !yid.isConstant();
        DdOperations<BddNode> manager = manager();
        int xvar = x.variable();
        int yvar = y.variable();

        if (xvar < yvar) {
            DdIndex low = manager.and(x.low(), yid);
            DdIndex high = manager.and(x.high(), yid);
            return manager.allocate(new BddNode(xvar, low, high));
        }
        if (yvar < xvar) {
            DdIndex low = manager.and(y.low(), xid);
            DdIndex high = manager.and(y.high(), xid);
            return manager.allocate(new BddNode(yvar, low, high));
        }
        DdIndex low = manager.and(x.low(), y.low());
        DdIndex high = manager.and(x.high(), y.high());
        return manager.allocate(new BddNode(xvar, low, high));
    }

    @Override
    public DdIndex exists(DdIndex xid, BddNode x, VariableSet variables) {
        if (x.variable() > variables.maxIndex()) {
            return xid;
        }

        DdOperations<BddNode> manager = manager();
        DdIndex low = manager.exists(x.low(), variables);
        DdIndex high = manager.exists(x.high(), variables);
        if (variables.contains(x.variable())) {
            return manager.or(low, high);
        }
        return manager.allocate(new BddNode(x.variable(), low, high));
    }

    @Override
    public DdIndex replace(DdIndex xid, BddNode x, VariableMap variableMap) {
        if (x.variable() > variableMap.maxIndex()) {
            return xid;
        }

        DdOperations<BddNode> manager = manager();
        DdIndex low = manager.replace(x.low(), variableMap);
        DdIndex high = manager.replace(x.high(), variableMap);
        return manager.repairOrder(variableMap.apply(x.variable()), low, high);
    }

    /**
     * Variables smaller than {@code level} are pulled above it, children on {@code level} itself
     * contribute their matching cofactor.
     */
    @Override
    public DdIndex repairOrder(int level, DdIndex low, DdIndex high) {
        assert level >= 0;
        DdOperations<BddNode> manager = manager();

        @Nullable
        BddNode lowNode = low.isConstant() ? null : effectiveNode(manager, low);
        @Nullable
        BddNode highNode = high.isConstant() ? null : effectiveNode(manager, high);
        int lowLevel = lowNode == null ? LEAF_LEVEL : lowNode.variable();
        int highLevel = highNode == null ? LEAF_LEVEL : highNode.variable();

        if (level < lowLevel && level < highLevel) {
            return manager.allocate(new BddNode(level, low, high));
        }

        if (Math.min(lowLevel, highLevel) == level) {
            // The variable already is the top of a branch, only the matching cofactor of that branch
            // remains
            DdIndex newLow = lowLevel == level ? lowNode.low() : low;
            DdIndex newHigh = highLevel == level ? highNode.high() : high;
            return manager.allocate(new BddNode(level, newLow, newHigh));
        }

        if (lowLevel < highLevel) {
            assert lowNode != null;
            DdIndex newLow = manager.repairOrder(level, lowNode.low(), high);
            DdIndex newHigh = manager.repairOrder(level, lowNode.high(), high);
            return manager.allocate(new BddNode(lowLevel, newLow, newHigh));
        }
        if (highLevel < lowLevel) {
            assert highNode != null;
            DdIndex newLow = manager.repairOrder(level, low, highNode.low());
            DdIndex newHigh = manager.repairOrder(level, low, highNode.high());
            return manager.allocate(new BddNode(highLevel, newLow, newHigh));
        }
        assert lowNode != null && highNode != null;
        DdIndex newLow = manager.repairOrder(level, lowNode.low(), highNode.low());
        DdIndex newHigh = manager.repairOrder(level, lowNode.high(), highNode.high());
        return manager.allocate(new BddNode(lowLevel, newLow, newHigh));
    }

    private BddNode effectiveNode(DdOperations<BddNode> manager, DdIndex index) {
        BddNode node = manager.node(index.position());
        return index.isComplemented() ? flip(node) : node;
    }

    @Override
    public BddNode flip(BddNode node) {
        return new BddNode(node.variable(), node.low().flip(), node.high().flip());
    }

    @Override
    public BddNode id(int variable) {
        return new BddNode(variable, DdIndex.FALSE, DdIndex.TRUE);
    }

    @Override
    @Nullable
    public DdIndex reduce(BddNode node) {
        return node.low().equals(node.high()) ? node.low() : null;
    }

    @Override
    public String display(BddNode node, boolean negated) {
        DdOperations<BddNode> manager = manager();
        return String.format(
                "(%d ? %s : %s)",
                node.variable(),
                manager.display(node.high(), negated),
                manager.display(node.low(), negated));
    }

    @Override
    public void sat(BddNode node, boolean high, Map<Integer, Boolean> assignment) {
        assignment.put(node.variable(), high);
    }
}
