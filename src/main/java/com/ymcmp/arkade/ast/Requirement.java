package com.ymcmp.arkade.ast;

public abstract class Requirement {

    public abstract <R> R accept(RequirementVisitor<R> visitor);
}
