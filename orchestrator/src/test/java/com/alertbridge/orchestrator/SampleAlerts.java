package com.alertbridge.orchestrator;

/** Alert texts shared by the tests, as they arrive from chat. */
public final class SampleAlerts {

    public static final String CHANNEL = "servicecore-mobile-errors";

    public static final String RUM_TYPE_ERROR = """
            Triggered: High number of errors in RUM on @issue.id:e1266418-913a-11ef-b48a-da7ad0900002
            High number of errors on issue detected.

            undefined is not an object (evaluating 'vm_r3.job.type') : TypeError: undefined is not an object (evaluating 'vm_r3.job.type')
              at executeTemplate @ capacitor://localhost/vendor.js:115793:15
              at refreshView @ capacitor://localhost/vendor.js:117360:22
              at detectChangesInView @ capacitor://localhost/vendor.js:117568:16

            @slack-ServiceCore-servicecore-mobile-errors

            The count of RUM errors matching service:mobile, grouped by @issue.id, was > 20 during the last 5m.""";

    public static final String CHATTER = """
            Hey team, just a heads up that we're seeing some issues with the mobile app today.
            Can someone take a look?""";

    private SampleAlerts() {}
}
