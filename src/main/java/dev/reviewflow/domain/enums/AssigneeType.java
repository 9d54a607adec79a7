package dev.reviewflow.domain.enums;

public enum AssigneeType {
    USER, ROLE
}
