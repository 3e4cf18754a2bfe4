package com.escrow.jobs.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Request record carrying the freelancer's proof reference */
public record SubmitWorkRequest(@JsonProperty("proofHash") String proofHash) {}
