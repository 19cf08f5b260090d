package com.gentoro.hierarchy;

import com.gentoro.hierarchy.utility.StdoutUtility;

public class HierarchyResolverApp {

  private static final org.slf4j.Logger log =
      com.gentoro.hierarchy.logging.LoggingService.getLogger(HierarchyResolverApp.class);

  public static void main(String[] args) {
    try {
      HierarchyResolver app = new HierarchyResolver(args);
      if ("help".equals(app.startupParameters().mode())) {
        StdoutUtility.printLine(HierarchyResolver.USAGE);
        return;
      }
      app.initialize();
      StdoutUtility.printLine(app.run());
    } catch (Exception e) {
      log.error("Hierarchy resolver failed", e);
      StdoutUtility.printError("Hierarchy resolver failed", e);
      System.exit(1);
    }
  }
}
