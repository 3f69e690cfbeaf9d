package com.ebayseller.scraper;

/**
 * Seller-level statistics shown in the dashboard header.
 * Each field is replaced wholesale when its scrape succeeds and left stale otherwise;
 * null means the value has never been read.
 */
public class SellerStats {
    private String feedbackScore;
    private Integer itemsSold;
    private Integer followerCount;

    public String getFeedbackScore() { return feedbackScore; }
    public void setFeedbackScore(String feedbackScore) { this.feedbackScore = feedbackScore; }

    public Integer getItemsSold() { return itemsSold; }
    public void setItemsSold(Integer itemsSold) { this.itemsSold = itemsSold; }

    public Integer getFollowerCount() { return followerCount; }
    public void setFollowerCount(Integer followerCount) { this.followerCount = followerCount; }
}
