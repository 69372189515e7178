package com.example.billing;

public class Auditor {

    private Ledger ledger;

    public void attach(Ledger ledger) {
        this.ledger = ledger;
    }

    public void review(String entry) {
        if (entry.isEmpty()) {
            return;
        }
        ledger.reconcile();
    }
}
