/*
 * どこで: Auth API
 * 何を: エラー応答の標準フォーマットを定義する
 * なぜ: フィルタ・エントリポイント・コントローラのどこで拒否しても同じ形で返すため
 */
package com.example.auth.api;

public record ApiErrorResponse(String code, String message) {}
