/*
 * どこで: Game Session API
 * 何を: エラー応答の標準フォーマットを定義する
 * なぜ: REST と WebSocket の error で同じ code 体系を返すため
 */
package com.example.gamesession.api;

public record ApiErrorResponse(String code, String message) {}
