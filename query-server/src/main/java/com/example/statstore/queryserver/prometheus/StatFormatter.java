package com.example.statstore.queryserver.prometheus;

import com.example.statstore.common.types.Aggregate;

import java.util.List;

@FunctionalInterface
public interface StatFormatter {

    List<String> format(String label, Aggregate aggregate);
}
