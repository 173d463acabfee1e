package com.anthem.billtriage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Failed bill triage service.
 *
 * Lists bills that failed automated adjudication, offers filtered and grouped views over them,
 * and accepts operator rate assignments (per procedure code or per category).
 */
@SpringBootApplication
public class BillTriageApplication {

    public static void main(String[] args) {
        SpringApplication.run(BillTriageApplication.class, args);
    }
}
