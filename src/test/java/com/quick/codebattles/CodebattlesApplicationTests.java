package com.quick.codebattles;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class CodebattlesApplicationTests {

    @Test
    void contextLoads() {
    }
}
