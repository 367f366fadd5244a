package com.driftops.model;

public enum EvaluationSource {
    TRAINING,
    HOLDOUT,
    AB_TEST
}
