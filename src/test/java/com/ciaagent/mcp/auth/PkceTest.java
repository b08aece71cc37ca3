package com.ciaagent.mcp.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PkceTest {

    @Test
    void challengeMatchesRfc7636Example() {
        assertEquals("E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM",
                Pkce.challengeFor("dBjftJeZ4CVP-mJ92ZXZjN8BSwPCFdZuHBcwoAf3Dl4"));
    }

    @Test
    void generatesUrlSafeVerifierAndHexState() {
        var pkce = Pkce.generate();

        assertEquals(43, pkce.verifier().length());
        assertTrue(pkce.verifier().matches("[A-Za-z0-9_-]+"));
        assertTrue(pkce.state().matches("[0-9a-f]{32}"));
        assertEquals(Pkce.challengeFor(pkce.verifier()), pkce.challenge());
    }

    @Test
    void everyAttemptIsFresh() {
        var a = Pkce.generate();
        var b = Pkce.generate();

        assertNotEquals(a.verifier(), b.verifier());
        assertNotEquals(a.state(), b.state());
    }
}
