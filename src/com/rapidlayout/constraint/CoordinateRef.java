package com.rapidlayout.constraint;

import java.util.Objects;

public final class CoordinateRef {

    public enum Role {
        SUBJECT("s"),
        OBJECT("o");

        private final String prefix;

        Role(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }
    }

    private final Role role;
    private final Corner corner;

    private CoordinateRef(Role role, Corner corner) {
        this.role = Objects.requireNonNull(role);
        this.corner = Objects.requireNonNull(corner);
    }

    public static CoordinateRef subject(Corner corner) {
        return new CoordinateRef(Role.SUBJECT, corner);
    }

    public static CoordinateRef object(Corner corner) {
        return new CoordinateRef(Role.OBJECT, corner);
    }

    public static CoordinateRef resolve(String identifier, boolean relative) {
        Corner corner = Corner.fromToken(identifier);
        if (corner != null) {
            return relative ? null : subject(corner);
        }
        if (identifier.length() != 3) {
            return null;
        }
        corner = Corner.fromToken(identifier.substring(1));
        if (corner == null) {
            return null;
        }
        switch (identifier.charAt(0)) {
            case 's':
                return subject(corner);
            case 'o':
                return relative ? object(corner) : null;
            default:
                return null;
        }
    }

    public Role getRole() {
        return role;
    }

    public Corner getCorner() {
        return corner;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CoordinateRef)) {
            return false;
        }
        CoordinateRef other = (CoordinateRef) obj;
        return role == other.role && corner == other.corner;
    }

    @Override
    public int hashCode() {
        return role.ordinal() * 4 + corner.getSlot();
    }

    @Override
    public String toString() {
        return role.getPrefix() + corner.getToken();
    }
}
