package com.automate.ScanOps.Service;

import com.automate.ScanOps.Models.Severity;
import com.automate.ScanOps.entity.RunEntity;

import java.util.List;

/**
 * Turns the output of a completed run into findings. Deployments plug in their own bean;
 * the default one produces nothing.
 */
public interface FindingSummarizer {

    record Finding(String title, Severity severity, String category, String description) {}

    List<Finding> summarize(RunEntity run);
}
