package org.calista.morphon.engine.classify;

import java.util.List;
import java.util.Objects;

/** One of the 49 instruction-equivalence classes with its reference members. */
public final class InstructionClass {
    private final int id;
    private final ClassRole role;
    private final List<String> members;

    public InstructionClass(int id, ClassRole role, List<String> members) {
        this.id = id;
        this.role = Objects.requireNonNull(role, "role");
        this.members = List.copyOf(members);
    }

    public int id() { return id; }
    public ClassRole role() { return role; }
    public List<String> members() { return members; }

    @Override
    public String toString() {
        return "C" + id + "(" + role + ", " + members.size() + " members)";
    }
}
