package win.ixuni.gcsmock.core.api;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * File operations whose next result can be replaced by a queued error
 */
public enum MockableMethod {
    EXISTS("exists"),
    DELETE("delete"),
    DOWNLOAD("download"),
    SAVE("save"),
    GET_SIGNED_URL("getSignedUrl"),
    SET_METADATA("setMetadata"),
    GET_METADATA("getMetadata");

    private final String methodName;

    MockableMethod(String methodName) {
        this.methodName = methodName;
    }

    /**
     * @return 客户端 API 中的方法名，如 "getSignedUrl"
     */
    public String getMethodName() {
        return methodName;
    }

    /**
     * Resolve a method by its client API name
     *
     * @param methodName method name, e.g. "setMetadata"
     * @return the mockable method
     * @throws IllegalArgumentException if the method cannot be mocked
     */
    public static MockableMethod fromMethodName(String methodName) {
        for (MockableMethod method : values()) {
            if (method.methodName.equals(methodName)) {
                return method;
            }
        }
        String supported = Arrays.stream(values())
                .map(MockableMethod::getMethodName)
                .collect(Collectors.joining(", "));
        throw new IllegalArgumentException(
                "Method '" + methodName + "' is not mockable, use one of these: " + supported);
    }
}
