package com.openfashion.campaignservice.client.custody.dto;

public enum CustodyTransferStatus {
    APPROVED,
    DECLINED
}
