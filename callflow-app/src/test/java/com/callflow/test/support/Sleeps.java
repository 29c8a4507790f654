package com.callflow.test.support;

public final class Sleeps {

    private Sleeps() {
    }

    /**
     * 模拟慢调用；被中断时恢复中断标记并结束调用。
     */
    public static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", ex);
        }
    }
}
