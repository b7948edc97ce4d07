package com.rapidlayout.cell;

import java.util.Objects;

public final class Constraint {

    private final ConstraintKind kind;
    private final Cell owner;
    private final Cell subject;
    private final Cell object;
    private final String text;
    private final String sourceText;

    Constraint(ConstraintKind kind, Cell owner, Cell subject, Cell object, String text, String sourceText) {
        this.kind = kind;
        this.owner = Objects.requireNonNull(owner);
        this.subject = Objects.requireNonNull(subject);
        this.object = object;
        this.text = text;
        this.sourceText = sourceText;
        assert kind.hasObject() == (object != null);
    }

    public ConstraintKind getKind() {
        return kind;
    }

    public Cell getOwner() {
        return owner;
    }

    public Cell getSubject() {
        return subject;
    }

    public Cell getObject() {
        return object;
    }

    // relation text after keyword expansion
    public String getText() {
        return text;
    }

    // relation text as the caller wrote it
    public String getSourceText() {
        return sourceText;
    }

    Constraint rebind(Cell newOwner, Cell newSubject, Cell newObject) {
        return new Constraint(kind, newOwner, newSubject, newObject, text, sourceText);
    }

    @Override
    public String toString() {
        switch (kind) {
            case SELF:
                return String.format("%s: '%s'", owner.getName(), text);
            case ABSOLUTE:
                return String.format("%s: %s '%s'", owner.getName(), subject.getName(), text);
            default:
                return String.format("%s: %s '%s' %s", owner.getName(), subject.getName(), text, object.getName());
        }
    }
}
