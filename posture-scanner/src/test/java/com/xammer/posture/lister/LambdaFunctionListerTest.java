package com.xammer.posture.lister;

import com.xammer.posture.domain.Resource;
import com.xammer.posture.rules.LambdaRules;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.FunctionConfiguration;
import software.amazon.awssdk.services.lambda.model.GetFunctionConcurrencyRequest;
import software.amazon.awssdk.services.lambda.model.GetFunctionConcurrencyResponse;
import software.amazon.awssdk.services.lambda.model.GetPolicyRequest;
import software.amazon.awssdk.services.lambda.model.GetPolicyResponse;
import software.amazon.awssdk.services.lambda.model.ListFunctionsRequest;
import software.amazon.awssdk.services.lambda.model.ListFunctionsResponse;
import software.amazon.awssdk.services.lambda.model.ResourceNotFoundException;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.withSettings;

class LambdaFunctionListerTest {

    @Test
    void shouldTreatMissingPolicyAsAbsentAttribute() {
        LambdaClient lambda = mock(LambdaClient.class, withSettings().defaultAnswer(CALLS_REAL_METHODS));
        doReturn(ListFunctionsResponse.builder().functions(
                        FunctionConfiguration.builder().functionName("plain").build(),
                        FunctionConfiguration.builder().functionName("hardened")
                                .kmsKeyArn("arn:aws:kms:us-east-1:123:key/k").build())
                .build())
                .when(lambda).listFunctions(any(ListFunctionsRequest.class));
        doReturn(GetFunctionConcurrencyResponse.builder().build())
                .when(lambda).getFunctionConcurrency(argThat((GetFunctionConcurrencyRequest r) -> "plain".equals(r.functionName())));
        doReturn(GetFunctionConcurrencyResponse.builder().reservedConcurrentExecutions(5).build())
                .when(lambda).getFunctionConcurrency(argThat((GetFunctionConcurrencyRequest r) -> "hardened".equals(r.functionName())));
        doThrow(ResourceNotFoundException.builder().message("No policy is associated with the given resource.").build())
                .when(lambda).getPolicy(argThat((GetPolicyRequest r) -> "plain".equals(r.functionName())));
        doReturn(GetPolicyResponse.builder().policy("{\"Statement\":[]}").build())
                .when(lambda).getPolicy(argThat((GetPolicyRequest r) -> "hardened".equals(r.functionName())));

        List<Resource> functions = new LambdaFunctionLister(lambda).list().collect(Collectors.toList());

        Resource plain = functions.get(0);
        assertEquals("plain", plain.getId());
        assertFalse(plain.has(LambdaRules.KMS_KEY_ARN));
        assertFalse(plain.has(LambdaRules.RESERVED_CONCURRENCY));
        assertFalse(plain.has(LambdaRules.RESOURCE_POLICY));

        Resource hardened = functions.get(1);
        assertEquals(5, hardened.integer(LambdaRules.RESERVED_CONCURRENCY).orElseThrow());
        assertEquals("{\"Statement\":[]}", hardened.string(LambdaRules.RESOURCE_POLICY).orElseThrow());
    }
}
