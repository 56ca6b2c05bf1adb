package com.dinoventures.economy.exception;

public class GroupNotFoundException extends EconomyException {
    public GroupNotFoundException(long id) {
        super(ErrorCode.GROUP_NOT_FOUND, "Group not found: id=" + id);
    }
}
