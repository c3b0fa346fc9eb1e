package composition.analyzer.extract;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Domain filter and category derivation for apiVersion strings.
 * <p>
 * Category is the API group label right before {@code .crossplane.io} or {@code .upbound.io}:
 * {@code ec2.aws.upbound.io/v1beta1 -> aws}, {@code fn.crossplane.io/v1beta1 -> fn}.
 */
public final class ApiCategories {

    public static final String OTHER = "other";

    private static final String CROSSPLANE_SUFFIX = ".crossplane.io/";
    private static final String UPBOUND_SUFFIX = ".upbound.io/";

    private static final Pattern CROSSPLANE_GROUP = Pattern.compile("([^.]+)\\.crossplane\\.io");
    private static final Pattern UPBOUND_GROUP = Pattern.compile("([^.]+)\\.upbound\\.io");

    private ApiCategories() {
    }

    public static boolean isManagedApiVersion(String apiVersion) {
        if (apiVersion == null) {
            return false;
        }
        return apiVersion.contains(CROSSPLANE_SUFFIX) || apiVersion.contains(UPBOUND_SUFFIX);
    }

    public static String categoryOf(String apiVersion) {
        if (apiVersion == null || apiVersion.isEmpty()) {
            return OTHER;
        }
        // crossplane wins when both appear
        final Matcher crossplane = CROSSPLANE_GROUP.matcher(apiVersion);
        if (crossplane.find()) {
            return crossplane.group(1);
        }
        final Matcher upbound = UPBOUND_GROUP.matcher(apiVersion);
        if (upbound.find()) {
            return upbound.group(1);
        }
        return OTHER;
    }
}
