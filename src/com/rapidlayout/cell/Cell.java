package com.rapidlayout.cell;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import com.rapidlayout.LayoutException;
import com.rapidlayout.constraint.ConstraintKeywords;

public class Cell {

    private static final AtomicLong idCounter = new AtomicLong(0);

    private final long id;
    private String name;
    private final boolean leaf;
    private final String layerName;

    private final List<Cell> children;
    private final List<Constraint> constraints;

    private BoundingBox box;

    private ReuseState reuseState = ReuseState.PLAIN;
    private FrozenLayout frozenLayout;
    private FixedLayout fixedLayout;

    public Cell(String name) {
        this(name, false, null);
    }

    public Cell(String name, String layerName) {
        this(name, true, layerName);
        if (layerName == null || layerName.isBlank()) {
            throw new IllegalArgumentException("Leaf cell '" + name + "' needs a layer name");
        }
    }

    public Cell(String name, Cell... children) {
        this(name, Arrays.asList(children));
    }

    public Cell(String name, List<Cell> children) {
        this(name, false, null);
        addChildren(children);
    }

    private Cell(String name, boolean leaf, String layerName) {
        if (name == null) {
            throw new IllegalArgumentException("Cell name should not be null");
        }
        this.id = idCounter.incrementAndGet();
        this.name = name;
        this.leaf = leaf;
        this.layerName = layerName;
        this.children = new ArrayList<>();
        this.constraints = new ArrayList<>();
    }

    // Hierarchy editing
    public Cell addChild(Cell child) {
        checkChild(child);
        children.add(child);
        return this;
    }

    public Cell addChildren(List<Cell> newChildren) {
        for (Cell child : newChildren) {
            addChild(child);
        }
        return this;
    }

    private void checkChild(Cell child) {
        if (child == null) {
            throw new IllegalArgumentException("Child of '" + name + "' should not be null");
        }
        if (leaf) {
            throw new IllegalStateException("Leaf cell '" + name + "' cannot hold children");
        }
        checkEditable();
        if (child == this) {
            throw new IllegalArgumentException("Cell '" + name + "' cannot be its own child");
        }
        for (Cell existing : children) {
            if (existing == child) {
                throw new IllegalArgumentException(
                    String.format("Cell '%s' is already a child of '%s'", child.name, name));
            }
        }
        if (child.contains(this)) {
            throw new IllegalArgumentException(
                String.format("Adding '%s' under '%s' would create a cycle", child.name, name));
        }
    }

    private boolean ensureRegistered(Cell cell) {
        if (!needsRegistration(cell)) {
            return false;
        }
        children.add(cell);
        return true;
    }

    private boolean needsRegistration(Cell cell) {
        if (cell == this || contains(cell)) {
            return false;
        }
        checkChild(cell);
        return true;
    }

    // Constraint building
    public Cell constrain(String relations) {
        checkConstraintText(relations);
        return addConstraint(ConstraintKind.SELF, this, null, relations);
    }

    public Cell constrain(Cell target, String relations) {
        checkNotNull(target, relations);
        checkConstraintText(relations);
        ensureRegistered(target);
        return addConstraint(ConstraintKind.ABSOLUTE, target, null, relations);
    }

    public Cell constrain(Cell subject, String relations, Cell object) {
        checkNotNull(subject, relations);
        if (object == null) {
            return constrain(subject, relations);
        }
        checkConstraintText(relations);
        // validate both cells before the tree changes
        boolean addSubject = needsRegistration(subject);
        boolean addObject = object != subject && needsRegistration(object);
        if (addSubject) {
            children.add(subject);
        }
        if (addObject) {
            children.add(object);
        }
        return addConstraint(ConstraintKind.RELATIVE, subject, object, relations);
    }

    // exact when tolerance is 0, otherwise the centers may differ by up to tolerance on each axis
    public Cell centerWithTolerance(Cell child, Cell ref, int tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("Centering tolerance should not be negative: " + tolerance);
        }
        Cell refCell = ref == null ? this : ref;
        constrain(child, ConstraintKeywords.centerRelations('x', tolerance), refCell);
        constrain(child, ConstraintKeywords.centerRelations('y', tolerance), refCell);
        return this;
    }

    private Cell addConstraint(ConstraintKind kind, Cell subject, Cell object, String relations) {
        checkEditable();
        String expanded = ConstraintKeywords.expand(relations);
        constraints.add(new Constraint(kind, this, subject, object, expanded, relations));
        return this;
    }

    private void checkConstraintText(String relations) {
        if (relations == null) {
            throw new IllegalArgumentException("Constraint string of '" + name + "' should not be null");
        }
        checkEditable();
    }

    private void checkNotNull(Cell cell, String relations) {
        if (cell == null) {
            throw new IllegalArgumentException(
                String.format("Constraint '%s' of '%s' references a null cell", relations, name));
        }
    }

    private void checkEditable() {
        if (reuseState == ReuseState.FROZEN) {
            throw new IllegalStateException("Cell '" + name + "' is frozen, unfreeze it before editing");
        }
        if (reuseState == ReuseState.FIXED) {
            throw new IllegalStateException("Cell '" + name + "' is fixed, unfix it before editing");
        }
    }

    // Traversal
    // children of frozen cells are hidden
    public List<Cell> collectReachable() {
        List<Cell> cells = new ArrayList<>();
        collectReachable(this, new HashSet<>(), cells);
        return cells;
    }

    private static void collectReachable(Cell cell, Set<Long> visited, List<Cell> cells) {
        if (!visited.add(cell.id)) {
            return;
        }
        cells.add(cell);
        if (cell.isFrozen()) {
            return;
        }
        for (Cell child : cell.children) {
            collectReachable(child, visited, cells);
        }
    }

    public boolean contains(Cell cell) {
        return contains(this, cell, new HashSet<>());
    }

    private static boolean contains(Cell current, Cell target, Set<Long> visited) {
        if (current == target) {
            return true;
        }
        if (!visited.add(current.id)) {
            return false;
        }
        for (Cell child : current.children) {
            if (contains(child, target, visited)) {
                return true;
            }
        }
        return false;
    }

    public void accept(CellVisitor visitor) {
        accept(visitor, 0, new HashSet<>());
    }

    private void accept(CellVisitor visitor, int depth, Set<Long> visited) {
        if (!visited.add(id)) {
            return;
        }
        if (visitor.enterCell(this, depth)) {
            for (Constraint constraint : constraints) {
                visitor.visitConstraint(this, constraint);
            }
            for (Cell child : children) {
                child.accept(visitor, depth + 1, visited);
            }
        }
        visitor.exitCell(this, depth);
    }

    // Geometry
    public boolean isResolved() {
        return box != null;
    }

    public boolean isSubtreeResolved() {
        for (Cell cell : collectReachable()) {
            if (!cell.isResolved()) {
                return false;
            }
        }
        return true;
    }

    public BoundingBox getBox() {
        return box;
    }

    public void setBox(BoundingBox box) {
        this.box = box;
    }

    private BoundingBox requireBox() {
        if (box == null) {
            throw new IllegalStateException("Cell '" + name + "' is not resolved yet");
        }
        return box;
    }

    public int getX1() {
        return requireBox().getX1();
    }

    public int getY1() {
        return requireBox().getY1();
    }

    public int getX2() {
        return requireBox().getX2();
    }

    public int getY2() {
        return requireBox().getY2();
    }

    public int getWidth() {
        return requireBox().getWidth();
    }

    public int getHeight() {
        return requireBox().getHeight();
    }

    public Cell moveTo(int x1, int y1) {
        BoundingBox current = requireBox();
        translate(x1 - current.getX1(), y1 - current.getY1());
        return this;
    }

    // descendants move along
    public void translate(int dx, int dy) {
        if (dx == 0 && dy == 0) {
            return;
        }
        translate(this, dx, dy, new HashSet<>());
    }

    private static void translate(Cell cell, int dx, int dy, Set<Long> visited) {
        if (!visited.add(cell.id)) {
            return;
        }
        if (cell.box != null) {
            cell.box = cell.box.translate(dx, dy);
        }
        for (Cell child : cell.children) {
            translate(child, dx, dy, visited);
        }
    }

    // Freeze
    public Cell freeze(CellSolver solver) {
        if (reuseState == ReuseState.FROZEN) {
            return this;
        }
        if (reuseState == ReuseState.FIXED) {
            throw new IllegalStateException("Cell '" + name + "' is fixed, unfix it before freezing");
        }
        solveIfNeeded(solver, "freeze");
        freezeResolved();
        return this;
    }

    public Cell freeze() {
        return freeze(null);
    }

    private void freezeResolved() {
        if (reuseState == ReuseState.FROZEN) {
            return;
        }
        if (reuseState == ReuseState.FIXED) {
            unfix();
        }
        for (Cell child : children) {
            if (!child.leaf) {
                child.freezeResolved();
            }
        }
        frozenLayout = new FrozenLayout(requireBox());
        reuseState = ReuseState.FROZEN;
    }

    public Cell unfreeze() {
        if (reuseState == ReuseState.FROZEN) {
            reuseState = ReuseState.PLAIN;
            frozenLayout = null;
        }
        for (Cell child : children) {
            if (!child.leaf) {
                child.unfreeze();
            }
        }
        return this;
    }

    public boolean isFrozen() {
        return reuseState == ReuseState.FROZEN;
    }

    public FrozenLayout getFrozenLayout() {
        return frozenLayout;
    }

    // Fix
    public Cell fix(CellSolver solver) {
        if (reuseState == ReuseState.FIXED) {
            return this;
        }
        if (reuseState == ReuseState.FROZEN) {
            throw new IllegalStateException("Cell '" + name + "' is frozen, unfreeze it before fixing");
        }
        solveIfNeeded(solver, "fix");
        fixedLayout = FixedLayout.capture(this);
        reuseState = ReuseState.FIXED;
        return this;
    }

    public Cell fix() {
        return fix(null);
    }

    public Cell unfix() {
        if (reuseState == ReuseState.FIXED) {
            reuseState = ReuseState.PLAIN;
            fixedLayout = null;
        }
        for (Cell child : children) {
            if (!child.leaf) {
                child.unfix();
            }
        }
        return this;
    }

    public boolean isFixed() {
        return reuseState == ReuseState.FIXED;
    }

    public FixedLayout getFixedLayout() {
        return fixedLayout;
    }

    public ReuseState getReuseState() {
        return reuseState;
    }

    private void solveIfNeeded(CellSolver solver, String action) {
        if (isSubtreeResolved()) {
            return;
        }
        if (solver == null) {
            throw new IllegalStateException(
                String.format("Cannot %s cell '%s': layout is not resolved and no solver was given", action, name));
        }
        if (!solver.solve(this) || !isSubtreeResolved()) {
            throw new LayoutException(String.format("Cannot %s cell '%s': solver failed", action, name));
        }
    }

    // Restores cloned reuse state, only used by CellCloner
    void restoreReuseState(ReuseState state, FrozenLayout frozen, FixedLayout fixed) {
        this.reuseState = state;
        this.frozenLayout = frozen;
        this.fixedLayout = fixed;
    }

    void addClonedConstraint(Constraint constraint) {
        constraints.add(constraint);
    }

    void addClonedChild(Cell child) {
        children.add(child);
    }

    // Cloning
    public Cell copy() {
        return CellCloner.clone(this, null);
    }

    public Cell copy(String newName) {
        return CellCloner.clone(this, newName);
    }

    // Accessors
    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Cell name should not be null");
        }
        this.name = name;
    }

    public boolean isLeaf() {
        return leaf;
    }

    public String getLayerName() {
        return layerName;
    }

    public List<Cell> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getChildCount() {
        return children.size();
    }

    public List<Constraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public String toTreeString() {
        return CellTreePrinter.print(this);
    }

    @Override
    public String toString() {
        String stateStr = reuseState == ReuseState.PLAIN ? "" : " [" + reuseState + "]";
        String boxStr = box == null ? "unresolved" : box.toString();
        return String.format("Cell(name=%s, id=%d, pos=%s, children=%d%s)", name, id, boxStr, children.size(), stateStr);
    }
}
