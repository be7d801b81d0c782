package com.hybridrouter.domain.feedback.model;

public enum FeedbackSource {
    ENGAGEMENT,          // reader interaction: clicks, time on card, shares
    EDITORIAL,           // editor accepted or rejected the item
    GENERATION_OUTCOME   // generated item and its sources, as returned by the provider
}
