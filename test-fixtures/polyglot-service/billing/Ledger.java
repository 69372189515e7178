package com.example.billing;

import java.util.ArrayList;
import java.util.List;

public class Ledger {

    private final Auditor auditor;
    private final List<String> entries = new ArrayList<>();

    public Ledger(Auditor auditor) {
        this.auditor = auditor;
    }

    public void post(String entry) {
        entries.add(entry);
        auditor.review(entry);
    }

    public void reconcile() {
        post("reconcile");
    }

    public int size() {
        return entries.size();
    }
}
