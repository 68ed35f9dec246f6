package com.deepansh.sectools.tool;

import com.deepansh.sectools.config.ToolProperties;
import com.deepansh.sectools.core.ExternalCallResult;
import com.deepansh.sectools.core.ProcessInvoker;
import com.deepansh.sectools.core.ResponseNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Shared plumbing for the scanner tools: prefix the configured binary,
 * run under the scanner's timeout, normalize the outcome.
 */
@Component
@RequiredArgsConstructor
public class ScannerRunner {

    private final ProcessInvoker processInvoker;
    private final ResponseNormalizer normalizer;

    public String run(ToolProperties.Scanner scanner, List<String> args, Set<Integer> successCodes) {
        return normalizer.normalize(invoke(scanner, args, successCodes));
    }

    public ExternalCallResult invoke(ToolProperties.Scanner scanner, List<String> args, Set<Integer> successCodes) {
        List<String> argv = new ArrayList<>(args.size() + 1);
        argv.add(scanner.binary());
        argv.addAll(args);
        return processInvoker.run(argv, scanner.timeout(), successCodes);
    }

    public ResponseNormalizer normalizer() {
        return normalizer;
    }
}
