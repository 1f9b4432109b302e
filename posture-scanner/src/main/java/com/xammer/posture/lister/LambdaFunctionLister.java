package com.xammer.posture.lister;

import com.xammer.posture.domain.Resource;
import com.xammer.posture.domain.ServiceType;
import com.xammer.posture.rules.LambdaRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.FunctionConfiguration;
import software.amazon.awssdk.services.lambda.model.ResourceNotFoundException;

import java.util.stream.Stream;

public class LambdaFunctionLister implements ResourceLister {

    private static final Logger logger = LoggerFactory.getLogger(LambdaFunctionLister.class);

    private final LambdaClient lambda;

    public LambdaFunctionLister(LambdaClient lambda) {
        this.lambda = lambda;
    }

    @Override
    public Stream<Resource> list() {
        return lambda.listFunctionsPaginator().functions().stream().map(this::toResource);
    }

    private Resource toResource(FunctionConfiguration function) {
        String name = function.functionName();
        Integer reserved = lambda.getFunctionConcurrency(r -> r.functionName(name)).reservedConcurrentExecutions();
        return Resource.builder(ServiceType.LAMBDA, LambdaRules.FUNCTION, name)
                .attribute(LambdaRules.RUNTIME, function.runtimeAsString())
                .attribute(LambdaRules.KMS_KEY_ARN, function.kmsKeyArn())
                .attribute(LambdaRules.RESERVED_CONCURRENCY, reserved)
                .attribute(LambdaRules.RESOURCE_POLICY, resourcePolicy(name))
                .build();
    }

    private String resourcePolicy(String functionName) {
        try {
            return lambda.getPolicy(r -> r.functionName(functionName)).policy();
        } catch (ResourceNotFoundException e) {
            logger.debug("No resource policy attached to Lambda function {}", functionName);
            return null;
        }
    }
}
