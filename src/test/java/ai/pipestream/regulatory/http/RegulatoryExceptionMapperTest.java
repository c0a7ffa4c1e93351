package ai.pipestream.regulatory.http;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegulatoryExceptionMapperTest {

    @Test
    void testStatusForErrorCodes() {
        assertEquals(404, RegulatoryExceptionMapper.statusFor("NOT_FOUND"));
        assertEquals(409, RegulatoryExceptionMapper.statusFor("ILLEGAL_TRANSITION"));
        assertEquals(409, RegulatoryExceptionMapper.statusFor("STALE_VERSION"));
        assertEquals(409, RegulatoryExceptionMapper.statusFor("RELEASE_REJECTED"));
        assertEquals(503, RegulatoryExceptionMapper.statusFor("INTEGRITY_VIOLATION"));
        assertEquals(500, RegulatoryExceptionMapper.statusFor("SOMETHING_ELSE"));
        assertEquals(500, RegulatoryExceptionMapper.statusFor(null));
    }
}
