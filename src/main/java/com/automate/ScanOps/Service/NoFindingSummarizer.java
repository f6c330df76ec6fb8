package com.automate.ScanOps.Service;

import com.automate.ScanOps.entity.RunEntity;
import org.springframework.stereotype.Component;

import java.util.List;

/** Default summarizer. Mark a replacement {@code @Primary} to take over. */
@Component
public class NoFindingSummarizer implements FindingSummarizer {

    @Override
    public List<Finding> summarize(RunEntity run) {
        return List.of();
    }
}
