package com.work.bonding.core.token;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TokenReturnDataTest {

    private static final String TRUE_WORD = "0x0000000000000000000000000000000000000000000000000000000000000001";
    private static final String FALSE_WORD = "0x0000000000000000000000000000000000000000000000000000000000000000";

    @Test
    public void empty_return_is_success() {
        assertTrue(TokenReturnData.isSuccess(null));
        assertTrue(TokenReturnData.isSuccess("0x"));
        assertTrue(TokenReturnData.isSuccess(""));
    }

    @Test
    public void bool_word_is_decoded() {
        assertTrue(TokenReturnData.isSuccess(TRUE_WORD));
        assertFalse(TokenReturnData.isSuccess(FALSE_WORD));
    }

    @Test
    public void malformed_return_is_failure() {
        assertFalse(TokenReturnData.isSuccess("0x01"));
        assertFalse(TokenReturnData.isSuccess(TRUE_WORD + "00"));
    }
}
