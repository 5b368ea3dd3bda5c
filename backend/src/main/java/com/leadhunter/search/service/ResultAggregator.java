package com.leadhunter.search.service;

import com.leadhunter.search.model.Lead;
import com.leadhunter.search.model.LeadRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders leads by score, highest first. The sort is stable, so equal scores keep merge order. Nothing is dropped.
 */
@Component
public class ResultAggregator {

    public List<LeadRecord> aggregate(List<Lead> leads) {
        List<LeadRecord> records = new ArrayList<>(leads.size());
        for (Lead lead : leads) {
            records.add(lead.toRecord());
        }
        records.sort(Comparator.comparingDouble(LeadRecord::score).reversed());
        return records;
    }
}
