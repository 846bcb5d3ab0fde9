package com.politest.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.iam.IamClient;

@Configuration
public class AwsConfig {

    // IAM is a global service
    @Value("${aws.iam.region:aws-global}")
    private String iamRegion;

    private DefaultCredentialsProvider getCredentialsProvider() {
        return DefaultCredentialsProvider.create();
    }

    @Bean
    public IamClient iamClient() {
        return IamClient.builder()
                .region(Region.of(iamRegion))
                .credentialsProvider(getCredentialsProvider())
                .build();
    }
}
