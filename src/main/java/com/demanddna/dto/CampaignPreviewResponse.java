package com.demanddna.dto;

import com.demanddna.engine.MultiplierPoint;
import com.demanddna.engine.ShockShape;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CampaignPreviewResponse {
    ShockShape shape;
    String campaignLabel;
    double liftPercent;
    long durationDays;
    double peakMultiplier;
    double meanMultiplier;
    List<MultiplierPoint> points;
}
