package com.questrail.mdl.format.ascii.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class MdlAsciiConfigTest
{
    @Test
    void defaultsAreLenientAndKeepSkins()
    {
        MdlAsciiConfig config = MdlAsciiConfig.defaults();

        assertFalse(config.flattenSkins());
        assertFalse(config.strict());
        assertNull(config.headerComment());
        assertNull(config.fileDependency());
    }

    @Test
    void builderSetsEveryOption()
    {
        MdlAsciiConfig config = MdlAsciiConfig.builder()
            .withFlattenSkins(true)
            .withStrict(true)
            .withHeaderComment("exported by tests")
            .withFileDependency("c_test.max")
            .build();

        assertTrue(config.flattenSkins());
        assertTrue(config.strict());
        assertEquals("exported by tests", config.headerComment());
        assertEquals("c_test.max", config.fileDependency());
    }

    @Test
    void multiLineCommentIsRejected()
    {
        assertThrows(IllegalArgumentException.class,
            () -> MdlAsciiConfig.builder().withHeaderComment("one\ntwo").build());
    }
}
