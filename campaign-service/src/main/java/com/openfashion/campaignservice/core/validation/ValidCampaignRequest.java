package com.openfashion.campaignservice.core.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Constraint(validatedBy = CampaignRequestValidator.class)
@Documented
public @interface ValidCampaignRequest {

    String message() default "Inconsistent campaign parameters";
    Class<?>[] groups() default {};
    Class<? extends Payload>[] payload() default {};

}
