package com.anthem.billtriage.service;

import com.anthem.billtriage.model.AssignmentResult;
import com.anthem.billtriage.model.AssignmentWarning;

import java.util.List;

public record AssignmentOutcome(AssignmentResult result, List<AssignmentWarning> warnings) {}
