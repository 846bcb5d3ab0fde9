package com.politest.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.PrintStream;

@Configuration
public class ReportConfig {

    /**
     * Where test results and statement attributions are printed.
     */
    @Bean
    public PrintStream reportStream() {
        return System.out;
    }
}
