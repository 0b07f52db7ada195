package io.proddata.stencil.expression;

import java.util.Optional;

/**
 * Reads members and items of host values.
 */
public interface ValueAccessor {
    boolean supports(Value target);

    /**
     * The member of an object, empty when the object has no such member.
     */
    Optional<Value> member(Value target, String name);

    /**
     * The item of a list at an integer index, negative indexes counting from the end, or the member
     * of an object named by the string form of the index. Empty when out of bounds or missing.
     */
    Optional<Value> index(Value target, Value index);

    /**
     * Number of members of an object or items of a list.
     */
    int count(Value target);

    default boolean hasMember(Value target, String name) {
        return member(target, name).isPresent();
    }
}
