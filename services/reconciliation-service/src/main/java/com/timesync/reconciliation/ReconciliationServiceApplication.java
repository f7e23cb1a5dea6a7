package com.timesync.reconciliation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Reconciliation Service Application
 *
 * Keeps the time registrations of the external accounting system in line
 * with the event database:
 * - inserts and updates registrations from the leading database
 * - never touches invoiced registrations
 * - reports orphaned and out-of-sync registrations for manual follow-up
 * - verifies the external state after every run
 */
@SpringBootApplication
@EnableScheduling
public class ReconciliationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReconciliationServiceApplication.class, args);
    }
}
